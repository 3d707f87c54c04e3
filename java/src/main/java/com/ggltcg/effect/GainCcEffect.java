package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.List;
import java.util.Optional;

/**
 * gain_cc:&lt;n&gt;[:not_first_turn] - the player gains n CC.
 */
public class GainCcEffect extends AbstractEffect implements PlayEffect {
    public static final String KEYWORD = "gain_cc";

    private final int amount;
    private final boolean notFirstTurn;

    public GainCcEffect(Card source, int amount, boolean notFirstTurn) {
        super(source, KEYWORD);
        this.amount = amount;
        this.notFirstTurn = notFirstTurn;
    }

    @Override
    public Optional<String> playRestriction(GameView view, String playerId) {
        if (notFirstTurn && view.getState().isPlayersFirstTurn(playerId)) {
            return Optional.of(getSource().getName() + " cannot be played on your first turn");
        }
        return Optional.empty();
    }

    @Override
    public void resolve(List<Card> targets, String playerId, EffectContext context) {
        int gained = context.gainCc(playerId, amount);
        context.log(playerId + " gains " + gained + " CC");
    }
}
