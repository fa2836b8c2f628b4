package com.entity.extraction.confidence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes entity and relationship confidence from component factors.
 *
 * <p>Entity formula:</p>
 * <pre>
 * confidence = base * contextFactor * (1 + 0.2 * frequencyFactor) * (0.8 + 0.2 * methodAgreement)
 * </pre>
 *
 * <p>Relationship formula (weakest link):</p>
 * <pre>
 * confidence = min(sourceConfidence, targetConfidence) * relationStrength * contextSupport
 * </pre>
 *
 * <p>Both results are clamped to [0.0, 1.0]. Inputs are not validated: {@code frequencyFactor}
 * is any value &gt;= 0, the other factors are expected in [0.0, 1.0], and anything outside
 * those ranges is absorbed by the clamp. A {@code NaN} result clamps to 0.0.</p>
 */
public final class ConfidenceCalculator {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceCalculator.class);

    public static final double FREQUENCY_WEIGHT = 0.2;
    public static final double AGREEMENT_FLOOR = 0.8;
    public static final double AGREEMENT_WEIGHT = 0.2;

    private ConfidenceCalculator() {
    }

    public static double calculateEntityConfidence(double baseScore) {
        return calculateEntityConfidence(baseScore, 1.0, 0.0, 0.0);
    }

    public static double calculateEntityConfidence(double baseScore, double contextFactor) {
        return calculateEntityConfidence(baseScore, contextFactor, 0.0, 0.0);
    }

    public static double calculateEntityConfidence(double baseScore, double contextFactor,
                                                   double frequencyFactor) {
        return calculateEntityConfidence(baseScore, contextFactor, frequencyFactor, 0.0);
    }

    /**
     * @param baseScore       base confidence from the extraction method (0-1)
     * @param contextFactor   clarity of the surrounding context (0-1)
     * @param frequencyFactor repeated-mention boost (0+)
     * @param methodAgreement agreement between extraction methods (0-1)
     * @return confidence in [0.0, 1.0]
     */
    public static double calculateEntityConfidence(double baseScore, double contextFactor,
                                                   double frequencyFactor, double methodAgreement) {
        double confidence = baseScore * contextFactor * (1 + FREQUENCY_WEIGHT * frequencyFactor);
        confidence = confidence * (AGREEMENT_FLOOR + AGREEMENT_WEIGHT * methodAgreement);
        double clamped = clamp(confidence);

        log.trace("Entity confidence: base={} context={} frequency={} agreement={} result={}",
                baseScore, contextFactor, frequencyFactor, methodAgreement, clamped);

        return clamped;
    }

    public static double calculateRelationshipConfidence(double sourceConfidence, double targetConfidence,
                                                         double relationStrength) {
        return calculateRelationshipConfidence(sourceConfidence, targetConfidence, relationStrength, 1.0);
    }

    /**
     * @param sourceConfidence confidence in the source entity (0-1)
     * @param targetConfidence confidence in the target entity (0-1)
     * @param relationStrength strength of the relationship evidence (0-1)
     * @param contextSupport   support from the context (0-1)
     * @return confidence in [0.0, 1.0], never above the weaker endpoint scaled by the factors
     */
    public static double calculateRelationshipConfidence(double sourceConfidence, double targetConfidence,
                                                         double relationStrength, double contextSupport) {
        double entityConfidence = Math.min(sourceConfidence, targetConfidence);
        double clamped = clamp(entityConfidence * relationStrength * contextSupport);

        log.trace("Relationship confidence: source={} target={} strength={} support={} result={}",
                sourceConfidence, targetConfidence, relationStrength, contextSupport, clamped);

        return clamped;
    }

    /**
     * Clamps to [0.0, 1.0]; {@code NaN} becomes 0.0.
     */
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
