package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentResult;
import com.example.seoagent.model.AgentType;

/**
 * Агент анализа одного аспекта сайта. Набор агентов закрыт: по одному на каждый {@link AgentType}.
 */
public sealed interface AnalysisAgent permits AbstractAnalysisAgent {

    AgentType type();

    /**
     * Выполняет анализ. Не бросает исключений: любая ошибка превращается в результат со статусом failed.
     */
    AgentResult analyze(AgentProgressListener listener);

    default AgentResult analyze() {
        return analyze(null);
    }
}
