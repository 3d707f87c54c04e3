package com.ggltcg.effect;

import com.ggltcg.card.Card;

/**
 * Triggered CC gain. One class covers the three CC triggers in the grammar:
 * <ul>
 *   <li>gain_cc_when_sleeped:n - the owner gains n when the source is sleeped from play</li>
 *   <li>start_of_turn_gain_cc:n - the controller gains n at the start of their turn</li>
 *   <li>on_card_played_gain_cc:n - the controller gains n whenever they play another card</li>
 * </ul>
 */
public class GainCcTriggerEffect extends AbstractEffect implements TriggeredEffect {
    public static final String WHEN_SLEEPED_KEYWORD = "gain_cc_when_sleeped";
    public static final String START_OF_TURN_KEYWORD = "start_of_turn_gain_cc";
    public static final String CARD_PLAYED_KEYWORD = "on_card_played_gain_cc";

    private final TriggerTiming timing;
    private final int amount;

    private GainCcTriggerEffect(Card source, String keyword, TriggerTiming timing, int amount) {
        super(source, keyword);
        this.timing = timing;
        this.amount = amount;
    }

    public static GainCcTriggerEffect whenSleeped(Card source, int amount) {
        return new GainCcTriggerEffect(source, WHEN_SLEEPED_KEYWORD, TriggerTiming.WHEN_SLEEPED, amount);
    }

    public static GainCcTriggerEffect startOfTurn(Card source, int amount) {
        return new GainCcTriggerEffect(source, START_OF_TURN_KEYWORD, TriggerTiming.START_OF_TURN, amount);
    }

    public static GainCcTriggerEffect onCardPlayed(Card source, int amount) {
        return new GainCcTriggerEffect(source, CARD_PLAYED_KEYWORD, TriggerTiming.WHEN_OTHER_CARD_PLAYED, amount);
    }

    @Override
    public TriggerTiming getTiming() {
        return timing;
    }

    @Override
    public boolean shouldTrigger(TriggerEvent event, GameView view) {
        Card source = getSource();
        return switch (timing) {
            case WHEN_SLEEPED -> source.equals(event.subject());
            case START_OF_TURN -> source.isInPlay() && event.playerId().equals(source.getController());
            case WHEN_OTHER_CARD_PLAYED -> source.isInPlay()
                    && !source.equals(event.subject())
                    && event.playerId().equals(source.getController());
            case WHEN_PLAYED -> false;
        };
    }

    @Override
    public void apply(TriggerEvent event, EffectContext context) {
        // sleeped cards pay their owner; the others pay whoever controls them now
        String recipient = timing == TriggerTiming.WHEN_SLEEPED
                ? getSource().getOwner()
                : getSource().getController();
        int gained = context.gainCc(recipient, amount);
        context.log(getSource().getName() + " grants " + recipient + " " + gained + " CC");
    }

    public int getAmount() {
        return amount;
    }
}
