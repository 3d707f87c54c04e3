package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.card.CardDatabaseException;
import com.ggltcg.card.Stat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Parses effect grammar tokens ("keyword:arg:arg") into {@link EffectTemplate}s.
 * The keyword table is fixed when the parser is built; unknown keywords and bad
 * arguments are rejected at load time.
 */
public final class EffectParser {

    /**
     * Validates a token's arguments and returns the binder for it.
     * Throws IllegalArgumentException on bad arguments.
     */
    @FunctionalInterface
    interface TokenParser {
        Function<Card, Effect> parse(List<String> args);
    }

    private final Map<String, TokenParser> parsers;

    private EffectParser(Map<String, TokenParser> parsers) {
        this.parsers = Map.copyOf(parsers);
    }

    /**
     * Parser for the full card grammar.
     */
    public static EffectParser standard() {
        Map<String, TokenParser> p = new HashMap<>();

        // ---- Continuous ----
        p.put(StatBoostEffect.KEYWORD, args -> {
            requireArgs(StatBoostEffect.KEYWORD, args, 2, 2);
            List<Stat> stats = Stat.parseTarget(args.get(0));
            int amount = parseAmount(args.get(1));
            return source -> new StatBoostEffect(source, stats, amount);
        });
        p.put(SetTussleCostEffect.KEYWORD, args -> {
            requireArgs(SetTussleCostEffect.KEYWORD, args, 1, 1);
            int cost = parseAmount(args.get(0));
            return source -> new SetTussleCostEffect(source, cost);
        });
        p.put(SetSelfTussleCostEffect.KEYWORD, args -> {
            requireArgs(SetSelfTussleCostEffect.KEYWORD, args, 1, 2);
            int cost = parseAmount(args.get(0));
            boolean notTurn1 = parseFlag(args, 1, "not_turn_1");
            return source -> new SetSelfTussleCostEffect(source, cost, notTurn1);
        });
        p.put(ReduceCostBySleepingEffect.KEYWORD, args -> {
            requireArgs(ReduceCostBySleepingEffect.KEYWORD, args, 0, 0);
            return ReduceCostBySleepingEffect::new;
        });
        p.put(OpponentCostIncreaseEffect.KEYWORD, args -> {
            requireArgs(OpponentCostIncreaseEffect.KEYWORD, args, 1, 1);
            int amount = parseAmount(args.get(0));
            return source -> new OpponentCostIncreaseEffect(source, amount);
        });
        p.put(AlternativeCostEffect.KEYWORD, args -> {
            requireArgs(AlternativeCostEffect.KEYWORD, args, 0, 0);
            return AlternativeCostEffect::new;
        });
        p.put(OpponentImmunityEffect.KEYWORD, args -> {
            requireArgs(OpponentImmunityEffect.KEYWORD, args, 0, 0);
            return source -> new OpponentImmunityEffect(source, false);
        });
        p.put(OpponentImmunityEffect.TEAM_KEYWORD, args -> {
            requireArgs(OpponentImmunityEffect.TEAM_KEYWORD, args, 0, 0);
            return source -> new OpponentImmunityEffect(source, true);
        });
        p.put(EffectImmunityEffect.KEYWORD, args -> {
            requireArgs(EffectImmunityEffect.KEYWORD, args, 1, 1);
            String blocked = args.get(0);
            if (blocked.isBlank()) {
                throw new IllegalArgumentException("effect keyword must not be blank");
            }
            return source -> new EffectImmunityEffect(source, blocked);
        });
        p.put(AutoWinTussleEffect.KEYWORD, args -> {
            requireArgs(AutoWinTussleEffect.KEYWORD, args, 0, 0);
            return AutoWinTussleEffect::new;
        });
        p.put(CannotTussleEffect.KEYWORD, args -> {
            requireArgs(CannotTussleEffect.KEYWORD, args, 0, 0);
            return CannotTussleEffect::new;
        });
        p.put(DirectAttackAnyTimeEffect.KEYWORD, args -> {
            requireArgs(DirectAttackAnyTimeEffect.KEYWORD, args, 0, 0);
            return DirectAttackAnyTimeEffect::new;
        });
        p.put(DirectAttackAnyTimeEffect.SHORT_KEYWORD, p.get(DirectAttackAnyTimeEffect.KEYWORD));

        // ---- Triggered ----
        p.put(GainCcTriggerEffect.WHEN_SLEEPED_KEYWORD, args -> {
            requireArgs(GainCcTriggerEffect.WHEN_SLEEPED_KEYWORD, args, 1, 1);
            int amount = parseAmount(args.get(0));
            return source -> GainCcTriggerEffect.whenSleeped(source, amount);
        });
        p.put(GainCcTriggerEffect.START_OF_TURN_KEYWORD, args -> {
            requireArgs(GainCcTriggerEffect.START_OF_TURN_KEYWORD, args, 1, 1);
            int amount = parseAmount(args.get(0));
            return source -> GainCcTriggerEffect.startOfTurn(source, amount);
        });
        p.put(GainCcTriggerEffect.CARD_PLAYED_KEYWORD, args -> {
            requireArgs(GainCcTriggerEffect.CARD_PLAYED_KEYWORD, args, 1, 1);
            int amount = parseAmount(args.get(0));
            return source -> GainCcTriggerEffect.onCardPlayed(source, amount);
        });
        p.put(WeakenOpponentsEffect.KEYWORD, args -> {
            requireArgs(WeakenOpponentsEffect.KEYWORD, args, 0, 0);
            return WeakenOpponentsEffect::new;
        });

        // ---- Activated ----
        p.put(RemoveStaminaAbility.KEYWORD, args -> {
            requireArgs(RemoveStaminaAbility.KEYWORD, args, 1, 1);
            int amount = parseAmount(args.get(0));
            if (amount == 0) {
                throw new IllegalArgumentException("amount must be positive");
            }
            return source -> new RemoveStaminaAbility(source, amount);
        });

        // ---- Play ----
        p.put(GainCcEffect.KEYWORD, args -> {
            requireArgs(GainCcEffect.KEYWORD, args, 1, 2);
            int amount = parseAmount(args.get(0));
            boolean notFirstTurn = parseFlag(args, 1, "not_first_turn");
            return source -> new GainCcEffect(source, amount, notFirstTurn);
        });
        p.put(SleepAllEffect.KEYWORD, args -> {
            requireArgs(SleepAllEffect.KEYWORD, args, 0, 0);
            return SleepAllEffect::new;
        });
        p.put(SleepTargetEffect.KEYWORD, args -> {
            requireArgs(SleepTargetEffect.KEYWORD, args, 1, 1);
            int count = parseCount(args.get(0));
            return source -> new SleepTargetEffect(source, count);
        });
        p.put(UnsleepEffect.KEYWORD, args -> {
            requireArgs(UnsleepEffect.KEYWORD, args, 1, 2);
            int count = parseCount(args.get(0));
            boolean actionsOnly = parseFlag(args, 1, "action");
            return source -> new UnsleepEffect(source, count, actionsOnly);
        });
        p.put(ReturnAllToHandEffect.KEYWORD, args -> {
            requireArgs(ReturnAllToHandEffect.KEYWORD, args, 0, 0);
            return ReturnAllToHandEffect::new;
        });
        p.put(ReturnTargetToHandEffect.KEYWORD, args -> {
            requireArgs(ReturnTargetToHandEffect.KEYWORD, args, 1, 1);
            int count = parseCount(args.get(0));
            return source -> new ReturnTargetToHandEffect(source, count);
        });
        p.put(TurnStatBoostEffect.KEYWORD, args -> {
            requireArgs(TurnStatBoostEffect.KEYWORD, args, 2, 2);
            List<Stat> stats = Stat.parseTarget(args.get(0));
            int amount = parseAmount(args.get(1));
            return source -> new TurnStatBoostEffect(source, stats, amount);
        });
        p.put(CopyCardEffect.KEYWORD, args -> {
            requireArgs(CopyCardEffect.KEYWORD, args, 0, 0);
            return CopyCardEffect::new;
        });
        p.put(TakeControlEffect.KEYWORD, args -> {
            requireArgs(TakeControlEffect.KEYWORD, args, 0, 0);
            return TakeControlEffect::new;
        });

        return new EffectParser(p);
    }

    public Set<String> getKeywords() {
        return parsers.keySet();
    }

    /**
     * Parse a card's effect list. Entries may hold several tokens separated by ';'.
     */
    public List<EffectTemplate> parseAll(List<String> entries) throws CardDatabaseException {
        List<EffectTemplate> templates = new ArrayList<>();
        for (String entry : entries) {
            for (String token : entry.split(";")) {
                String trimmed = token.trim();
                if (!trimmed.isEmpty()) {
                    templates.add(parse(trimmed));
                }
            }
        }
        return templates;
    }

    /**
     * Parse a single token.
     *
     * @throws CardDatabaseException for unknown keywords or malformed arguments
     */
    public EffectTemplate parse(String token) throws CardDatabaseException {
        String[] parts = token.trim().split(":", -1);
        String keyword = parts[0];
        TokenParser parser = parsers.get(keyword);
        if (parser == null) {
            throw new CardDatabaseException("Unknown effect keyword '" + keyword + "' in token '" + token + "'");
        }
        List<String> args = Arrays.asList(parts).subList(1, parts.length);
        try {
            return new EffectTemplate(keyword, token.trim(), parser.parse(List.copyOf(args)));
        } catch (IllegalArgumentException e) {
            throw new CardDatabaseException("Malformed effect token '" + token + "': " + e.getMessage(), e);
        }
    }

    // ---- Argument helpers ----

    private static void requireArgs(String keyword, List<String> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + "-" + max;
            throw new IllegalArgumentException(keyword + " takes " + expected + " argument(s), got " + args.size());
        }
    }

    private static int parseAmount(String value) {
        int amount = Integer.parseInt(value.trim());
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + value);
        }
        return amount;
    }

    private static int parseCount(String value) {
        int count = parseAmount(value);
        if (count == 0) {
            throw new IllegalArgumentException("target count must be positive");
        }
        return count;
    }

    private static boolean parseFlag(List<String> args, int index, String flag) {
        if (args.size() <= index) {
            return false;
        }
        if (!flag.equals(args.get(index))) {
            throw new IllegalArgumentException("expected '" + flag + "' but got '" + args.get(index) + "'");
        }
        return true;
    }
}
