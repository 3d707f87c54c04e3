package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.GameState;

/**
 * opponent_immunity - the source is unaffected by effects of opponent-controlled cards.
 * team_opponent_immunity - the same for every card its controller has.
 * Combat damage is not an effect and is never blocked.
 */
public class OpponentImmunityEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "opponent_immunity";
    public static final String TEAM_KEYWORD = "team_opponent_immunity";

    private final boolean team;

    public OpponentImmunityEffect(Card source, boolean team) {
        super(source, team ? TEAM_KEYWORD : KEYWORD);
        this.team = team;
    }

    @Override
    public boolean protects(Card target, Effect incoming, GameState state) {
        String controller = getSource().getController();
        boolean covered = team ? target.getController().equals(controller) : target.equals(getSource());
        return covered && !incoming.getController().equals(controller);
    }

    public boolean isTeam() {
        return team;
    }
}
