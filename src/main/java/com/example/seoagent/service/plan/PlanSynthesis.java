package com.example.seoagent.service.plan;

import com.example.seoagent.model.ActionPlan;
import com.example.seoagent.model.CompetitiveIntelligence;
import com.example.seoagent.model.ContentStrategy;
import com.example.seoagent.model.ProgressTracking;
import lombok.Value;

/**
 * Все четыре раздела итогового синтеза.
 */
@Value
public class PlanSynthesis {
    ActionPlan actionPlan;
    CompetitiveIntelligence competitiveIntelligence;
    ContentStrategy contentStrategy;
    ProgressTracking progressTracking;
}
