package com.flip7.simulator.strategy;

import com.flip7.simulator.game.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the compact strategy notation used on the command line.
 * <pre>
 *   bust:0.15[:sc]          BustProbabilityStrategy
 *   cards:5[:sc]            CardCountStrategy
 *   points:45               PointThresholdStrategy
 *   hybrid:3:50:0.20[:sc]   HybridStrategy
 *   adaptive                UltimateAdaptiveStrategy
 * </pre>
 */
public final class StrategySpec {

    private StrategySpec() {
        // Utility class - prevent instantiation
    }

    /**
     * Parse one strategy spec.
     * @throws InvalidConfigurationException if the spec is unknown or malformed
     */
    public static BotStrategy parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidConfigurationException("Strategy spec cannot be empty");
        }

        String[] parts = spec.trim().toLowerCase(Locale.ROOT).split(":");
        boolean sc = parts.length > 1 && parts[parts.length - 1].equals("sc");
        int args = sc ? parts.length - 2 : parts.length - 1;

        return switch (parts[0]) {
            case "bust" -> {
                expectArgs(spec, args, 1);
                yield new BustProbabilityStrategy(parseDouble(spec, parts[1]), sc);
            }
            case "cards" -> {
                expectArgs(spec, args, 1);
                yield new CardCountStrategy(parseInt(spec, parts[1]), sc);
            }
            case "points" -> {
                expectArgs(spec, args, 1);
                rejectSecondChance(spec, sc);
                yield new PointThresholdStrategy(parseInt(spec, parts[1]));
            }
            case "hybrid" -> {
                expectArgs(spec, args, 3);
                yield new HybridStrategy(parseInt(spec, parts[1]), parseInt(spec, parts[2]),
                        parseDouble(spec, parts[3]), sc);
            }
            case "adaptive" -> {
                expectArgs(spec, args, 0);
                rejectSecondChance(spec, sc);
                yield new UltimateAdaptiveStrategy();
            }
            default -> throw new InvalidConfigurationException("Unknown strategy '" + parts[0]
                    + "' in '" + spec + "'. Use bust, cards, points, hybrid or adaptive.");
        };
    }

    public static List<BotStrategy> parseAll(List<String> specs) {
        List<BotStrategy> strategies = new ArrayList<>(specs.size());
        for (String spec : specs) {
            strategies.add(parse(spec));
        }
        return strategies;
    }

    private static void expectArgs(String spec, int actual, int expected) {
        if (actual != expected) {
            throw new InvalidConfigurationException("Strategy '" + spec + "' expects " + expected
                    + " parameter(s), got " + actual);
        }
    }

    private static void rejectSecondChance(String spec, boolean sc) {
        if (sc) {
            throw new InvalidConfigurationException("Strategy '" + spec + "' has no second-chance variant");
        }
    }

    private static int parseInt(String spec, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("'" + value + "' is not a whole number in '" + spec + "'", e);
        }
    }

    private static double parseDouble(String spec, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("'" + value + "' is not a number in '" + spec + "'", e);
        }
    }
}
