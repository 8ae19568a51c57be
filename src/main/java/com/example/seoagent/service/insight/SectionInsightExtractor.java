package com.example.seoagent.service.insight;

import com.example.seoagent.config.AppConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Построчный разбор: строка со словом из словаря переключает раздел,
 * пункты списка ("- ..." или "1. ...") добавляются в активный раздел.
 * Пункты до первого заголовка отбрасываются.
 */
@Component
public class SectionInsightExtractor implements InsightExtractor {

    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\d+\\..*");
    private static final Pattern ITEM_MARKER = Pattern.compile("^(?:-|\\d+[.)])\\s*");

    private enum Section { NONE, FINDINGS, RECOMMENDATIONS }

    private final int minLineLength;

    public SectionInsightExtractor() {
        this(0);
    }

    public SectionInsightExtractor(int minLineLength) {
        this.minLineLength = minLineLength;
    }

    @Autowired
    public SectionInsightExtractor(AppConfig appConfig) {
        this(appConfig.getInsights().getMinLineLength());
    }

    @Override
    public ExtractedInsights extract(String text, InsightVocabulary vocabulary) {
        if (text == null || text.isBlank()) {
            return ExtractedInsights.empty();
        }

        List<String> findings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        Section active = Section.NONE;

        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (vocabulary.isFindingHeader(lower)) {
                active = Section.FINDINGS;
            } else if (vocabulary.isRecommendationHeader(lower)) {
                active = Section.RECOMMENDATIONS;
            } else if (isListItem(line)) {
                String item = ITEM_MARKER.matcher(line).replaceFirst("").trim();
                if (item.length() <= minLineLength) {
                    continue;
                }
                if (active == Section.FINDINGS) {
                    findings.add(item);
                } else if (active == Section.RECOMMENDATIONS) {
                    recommendations.add(item);
                }
            }
        }

        return new ExtractedInsights(List.copyOf(findings), List.copyOf(recommendations));
    }

    private static boolean isListItem(String line) {
        return line.startsWith("-") || NUMBERED_ITEM.matcher(line).matches();
    }
}
