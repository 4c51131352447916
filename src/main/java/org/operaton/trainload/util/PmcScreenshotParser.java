package org.operaton.trainload.util;

import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.OcrTextElement;
import org.operaton.trainload.model.PmcReading;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads fitness, fatigue, form and daily TSS from the recognized text of a performance chart screenshot.
 *
 * The chart shows three columns with the value printed above its label
 * (Fitness on the left, Form in the middle, Fatigue on the right).
 * Coordinates are normalized with the origin at the bottom-left, so "above" means a larger y.
 */
@Component
@Slf4j
public class PmcScreenshotParser {

    private static final Pattern INTEGER = Pattern.compile("^([+-]?\\d+)$");
    private static final String[] DECORATIONS = {"↓", "↑", "⬇️", "⬆️", "⬇", "⬆", "▼", "▲", "↗", "↘", "→", "←", "•"};

    private static final double MIN_VALUE = -50;
    private static final double MAX_VALUE = 200;
    private static final double MAX_DAILY_TSS = 500;

    private static final double LABEL_X_TOLERANCE = 0.08;
    private static final double ROW_Y_TOLERANCE = 0.05;
    private static final double TSS_X_TOLERANCE = 0.25;
    private static final double TSS_Y_TOLERANCE = 0.15;

    private record NumberElement(OcrTextElement element, double value) {
    }

    /**
     * Parse a screenshot's text fragments.
     *
     * @param elements recognized text fragments
     * @return the reading, or empty when no label could be paired with a number
     */
    public Optional<PmcReading> parse(List<OcrTextElement> elements) {
        if (elements == null || elements.isEmpty()) {
            return Optional.empty();
        }

        List<OcrTextElement> fitnessLabels = labels(elements, t -> t.contains("fitness") || t.equals("ctl"));
        List<OcrTextElement> formLabels = labels(elements, t -> t.contains("form") || t.equals("tsb"));
        List<OcrTextElement> fatigueLabels = labels(elements, t -> t.contains("fatigue") || t.equals("atl"));

        List<NumberElement> numbers = new ArrayList<>();
        for (OcrTextElement element : elements) {
            parseNumber(element.text()).ifPresent(value -> numbers.add(new NumberElement(element, value)));
        }

        log.debug("Screenshot labels: fitness={}, form={}, fatigue={}, numbers={}",
                fitnessLabels.size(), formLabels.size(), fatigueLabels.size(), numbers.size());

        if (numbers.isEmpty()) {
            return Optional.empty();
        }

        Double ctl = firstAligned(fitnessLabels, numbers);
        Double tsb = firstAligned(formLabels, numbers);
        Double atl = firstAligned(fatigueLabels, numbers);
        int matches = count(ctl, tsb, atl);

        List<OcrTextElement> allLabels = new ArrayList<>();
        allLabels.addAll(fitnessLabels);
        allLabels.addAll(formLabels);
        allLabels.addAll(fatigueLabels);

        if (matches < 3 && allLabels.size() >= 2) {
            double labelY = allLabels.stream().mapToDouble(OcrTextElement::centerY).average().orElse(0);
            List<NumberElement> rowNumbers = numbers.stream()
                    .filter(n -> n.element().centerY() >= labelY - ROW_Y_TOLERANCE)
                    .sorted(Comparator.comparingDouble(n -> n.element().centerX()))
                    .toList();

            if (rowNumbers.size() >= 3) {
                log.debug("Falling back to column order with {} numbers", rowNumbers.size());
                if (ctl == null) {
                    ctl = nearestInColumn(fitnessLabels, rowNumbers, List.of());
                }
                if (tsb == null) {
                    tsb = nearestInColumn(formLabels, rowNumbers, nonNull(ctl));
                }
                if (atl == null) {
                    atl = nearestInColumn(fatigueLabels, rowNumbers, nonNull(ctl, tsb));
                }
                matches = count(ctl, tsb, atl);
            }
        }

        Double dailyTss = findDailyTss(elements, numbers);

        if (matches == 0) {
            log.warn("No performance chart values could be located on the screenshot");
            return Optional.empty();
        }

        double confidence = matches >= 3 ? 0.95 : matches == 2 ? 0.75 : 0.5;
        log.debug("Parsed screenshot: ctl={}, atl={}, tsb={}, dailyTss={}, confidence={}", ctl, atl, tsb, dailyTss, confidence);

        return Optional.of(PmcReading.builder()
                .ctl(ctl)
                .atl(atl)
                .tsb(tsb)
                .dailyTss(dailyTss)
                .confidence(confidence)
                .matchedValues(matches)
                .build());
    }

    Optional<Double> parseNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = text;
        for (String decoration : DECORATIONS) {
            cleaned = cleaned.replace(decoration, "");
        }
        cleaned = cleaned.trim();

        Matcher matcher = INTEGER.matcher(cleaned);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        double value = Double.parseDouble(matcher.group(1));
        if (value < MIN_VALUE || value > MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private List<OcrTextElement> labels(List<OcrTextElement> elements, Predicate<String> matches) {
        return elements.stream()
                .filter(e -> e.text() != null && matches.test(e.text().trim().toLowerCase(Locale.ROOT)))
                .toList();
    }

    private Double firstAligned(List<OcrTextElement> labels, List<NumberElement> numbers) {
        for (OcrTextElement label : labels) {
            Optional<NumberElement> above = numbers.stream()
                    .filter(n -> Math.abs(n.element().centerX() - label.centerX()) < LABEL_X_TOLERANCE)
                    .filter(n -> n.element().centerY() > label.centerY())
                    .min(Comparator.comparingDouble(n -> Math.abs(n.element().centerY() - label.centerY())));
            if (above.isPresent()) {
                return above.get().value();
            }
        }
        return null;
    }

    private Double nearestInColumn(List<OcrTextElement> labels, List<NumberElement> rowNumbers, List<Double> taken) {
        for (OcrTextElement label : labels) {
            Optional<NumberElement> nearest = rowNumbers.stream()
                    .min(Comparator.comparingDouble(n -> Math.abs(n.element().centerX() - label.centerX())));
            if (nearest.isPresent() && !taken.contains(nearest.get().value())) {
                return nearest.get().value();
            }
        }
        return null;
    }

    private Double findDailyTss(List<OcrTextElement> elements, List<NumberElement> numbers) {
        List<OcrTextElement> tssLabels = labels(elements, t -> t.contains("tss"));
        for (OcrTextElement label : tssLabels) {
            for (NumberElement number : numbers) {
                double dx = Math.abs(number.element().centerX() - label.centerX());
                double dy = Math.abs(number.element().centerY() - label.centerY());
                if (dx < TSS_X_TOLERANCE && dy < TSS_Y_TOLERANCE && number.value() <= MAX_DAILY_TSS) {
                    return number.value();
                }
            }
        }
        return null;
    }

    private static List<Double> nonNull(Double... values) {
        List<Double> result = new ArrayList<>();
        for (Double value : values) {
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    private static int count(Double... values) {
        return nonNull(values).size();
    }
}
