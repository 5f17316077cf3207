package com.calai.dietworkout.prediction;

import com.calai.dietworkout.prediction.model.FeatureVector;
import com.calai.dietworkout.prediction.model.ProfileField;
import com.calai.dietworkout.prediction.model.UserProfile;
import com.calai.dietworkout.prediction.service.FeatureVectorBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureVectorBuilderTest {

    private final FeatureVectorBuilder builder = new FeatureVectorBuilder();

    @Test
    void values_follow_fixed_field_order() {
        UserProfile p = new UserProfile(
                1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13,
                "", "", "Regular", "Gym", "general-fitness");

        FeatureVector v = builder.build(p);

        assertThat(v.size()).isEqualTo(13);
        assertThat(v.toArray()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13);
        assertThat(v.get(ProfileField.BMR_KCAL)).isEqualTo(10);
        assertThat(v.get(ProfileField.ACTIVITY_LEVEL)).isEqualTo(13);
    }

    @Test
    void personalization_fields_do_not_affect_vector() {
        UserProfile a = new UserProfile(
                30, 1, 160, 55, 21.5, 25.0, 40.2, 2.4, 52.0, 1300, 4, 27, 2,
                "", "", "Regular", "Gym", "general-fitness");
        UserProfile b = new UserProfile(
                30, 1, 160, 55, 21.5, 25.0, 40.2, 2.4, 52.0, 1300, 4, 27, 2,
                "nuts", "keto", "Vegan", "Home", "weight-loss");

        assertThat(builder.build(a)).isEqualTo(builder.build(b));
    }
}
