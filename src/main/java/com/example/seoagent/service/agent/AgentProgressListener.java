package com.example.seoagent.service.agent;

import com.example.seoagent.model.AgentResult;

/**
 * Колбэк прогресса агента. Получает снимок результата, а не сам результат.
 */
@FunctionalInterface
public interface AgentProgressListener {
    void onProgress(AgentResult snapshot, String step);
}
