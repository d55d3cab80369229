package com.cx.anomaly.service;

/**
 * Outbound alerts from scheduled batch scoring.
 */
public interface AlertNotifier {

    void notifyAnomalies(PredictionResult result);

    void notifyJobFailure(String job, Exception error);
}
