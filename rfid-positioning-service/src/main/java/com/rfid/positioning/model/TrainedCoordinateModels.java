package com.rfid.positioning.model;

/**
 * Independent X and Y regressors fitted on the same reference rows.
 *
 * @param xModel predicts the x coordinate
 * @param yModel predicts the y coordinate
 * @param featureCount length of the feature-vector prefix both models consume
 * @param algorithm name of the regression algorithm
 * @param trainingRows number of reference rows the models were fitted on
 */
public record TrainedCoordinateModels(
    RegressionModel xModel,
    RegressionModel yModel,
    int featureCount,
    String algorithm,
    int trainingRows) {}
