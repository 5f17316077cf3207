package com.calai.dietworkout.prediction.model;

/**
 * @param predictedDiet    kcal / day
 * @param predictedWorkout workout days / week
 */
public record PredictionResult(int predictedDiet, int predictedWorkout) {}
