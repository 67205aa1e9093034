package com.wellbeingplatform.orchestrator.pipeline;

import com.wellbeingplatform.common.integration.IndicatorCalculator;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.QueueItem;
import com.wellbeingplatform.common.model.QueueKind;
import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.orchestrator.config.OrchestratorSettings;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold rule shared by the real-time and periodic paths.
 * <pre>
 *   risk > riskThreshold  OR  peak risk signal > acuteSignalThreshold → intervention
 *   opportunity > opportunityThreshold                                → optimization
 * </pre>
 * The two checks are independent. Priorities are chosen by the caller.
 */
@Component
public class QueueDecisionPolicy {

    private final OrchestratorSettings settings;

    public QueueDecisionPolicy(OrchestratorSettings settings) {
        this.settings = settings;
    }

    public List<QueueItem> decide(String sessionId, IntegratedAnalysis analysis,
                                  QueuePriority interventionPriority,
                                  QueuePriority optimizationPriority) {
        List<QueueItem> items = new ArrayList<>();
        double peak = IndicatorCalculator.peakRiskSignal(analysis.signals());

        if (analysis.riskScore() > settings.riskThreshold() || peak > settings.acuteSignalThreshold()) {
            String reason = String.format("risk=%.2f peak %s=%.2f", analysis.riskScore(),
                IndicatorCalculator.peakRiskSignalName(analysis.signals()), peak);
            items.add(QueueItem.create(QueueKind.INTERVENTION, interventionPriority, sessionId,
                "immediate_support", reason, analysis));
        }
        if (analysis.opportunityScore() > settings.opportunityThreshold()) {
            String reason = String.format("opportunity=%.2f", analysis.opportunityScore());
            items.add(QueueItem.create(QueueKind.OPTIMIZATION, optimizationPriority, sessionId,
                "increase_challenge", reason, analysis));
        }
        return items;
    }

    public List<Recommendation> realtimeRecommendations(IntegratedAnalysis analysis) {
        return IndicatorCalculator.realtimeRecommendations(analysis.riskScore(), analysis.opportunityScore(),
            settings.riskThreshold(), settings.opportunityThreshold());
    }
}
