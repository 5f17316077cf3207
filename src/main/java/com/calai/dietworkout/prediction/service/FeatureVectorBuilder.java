package com.calai.dietworkout.prediction.service;

import com.calai.dietworkout.prediction.model.FeatureVector;
import com.calai.dietworkout.prediction.model.ProfileField;
import com.calai.dietworkout.prediction.model.UserProfile;
import org.springframework.stereotype.Component;

@Component
public class FeatureVectorBuilder {

    /** 順序同 {@link ProfileField}，shape [13] */
    public FeatureVector build(UserProfile p) {
        double[] x = new double[FeatureVector.SIZE];
        x[ProfileField.AGE.ordinal()] = p.age();
        x[ProfileField.GENDER.ordinal()] = p.gender();
        x[ProfileField.HEIGHT_CM.ordinal()] = p.heightCm();
        x[ProfileField.WEIGHT_KG.ordinal()] = p.weightKg();
        x[ProfileField.BMI.ordinal()] = p.bmi();
        x[ProfileField.BODY_FAT_PERCENT.ordinal()] = p.bodyFatPercent();
        x[ProfileField.MUSCLE_MASS_KG.ordinal()] = p.muscleMassKg();
        x[ProfileField.BONE_MASS_KG.ordinal()] = p.boneMassKg();
        x[ProfileField.WATER_PERCENT.ordinal()] = p.waterPercent();
        x[ProfileField.BMR_KCAL.ordinal()] = p.bmrKcal();
        x[ProfileField.VISCERAL_FAT.ordinal()] = p.visceralFat();
        x[ProfileField.METABOLIC_AGE.ordinal()] = p.metabolicAge();
        x[ProfileField.ACTIVITY_LEVEL.ordinal()] = p.activityLevel();
        return new FeatureVector(x);
    }
}
