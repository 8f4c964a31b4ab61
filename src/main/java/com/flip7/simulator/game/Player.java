package com.flip7.simulator.game;

import com.flip7.simulator.card.ActionCard;
import com.flip7.simulator.card.ActionType;
import com.flip7.simulator.card.Card;
import com.flip7.simulator.game.zones.Hand;

/**
 * A seat at the table. The hand and round flags reset every round;
 * the total score and the match counters persist for the whole match.
 */
public class Player {
    private final int seat;
    private final String id;
    private final String name;
    private final Hand hand;

    private int totalScore;
    private int roundScore;
    private RoundStatus status;
    private boolean secondChance;
    private boolean flipThreePending;

    // Match-wide counters
    private int busts;
    private int flip7s;

    public Player(int seat, String name) {
        this.seat = seat;
        this.id = "player_" + seat;
        this.name = name;
        this.hand = new Hand();
        this.status = RoundStatus.ACTIVE;
    }

    /**
     * Clear the hand and every per-round flag. Total score is untouched.
     */
    public void resetForRound() {
        hand.clear();
        roundScore = 0;
        status = RoundStatus.ACTIVE;
        secondChance = false;
        flipThreePending = false;
    }

    /**
     * Put a card in the hand and apply its action, if any.
     * Freeze is kept in the hand but does nothing.
     */
    public void takeCard(Card card) {
        hand.add(card);
        if (card instanceof ActionCard action) {
            if (action.getActionType() == ActionType.SECOND_CHANCE) {
                secondChance = true;
            } else if (action.getActionType() == ActionType.FLIP_THREE) {
                flipThreePending = true;
            }
        }
    }

    public boolean wouldBust(Card card) {
        return hand.wouldBust(card);
    }

    public boolean hasFlip7() {
        return hand.hasFlip7();
    }

    public int numberCardCount() {
        return hand.numberCardCount();
    }

    /**
     * Current hand value without the Flip 7 bonus.
     */
    public int currentScore() {
        return hand.score(false);
    }

    // ---- Round outcomes ----

    public void stay() {
        roundScore = hand.score(false);
        status = RoundStatus.STAYED;
    }

    public void bust() {
        roundScore = 0;
        status = RoundStatus.BUSTED;
        busts++;
    }

    public void completeFlip7() {
        roundScore = hand.score(true);
        status = RoundStatus.FLIP7;
        flip7s++;
    }

    /**
     * Spend the Second Chance token.
     */
    public void consumeSecondChance() {
        secondChance = false;
    }

    public void clearFlipThree() {
        flipThreePending = false;
    }

    /**
     * Add the round score to the running total.
     */
    public void bankRoundScore() {
        totalScore += roundScore;
    }

    // ---- Accessors ----

    public int getSeat() {
        return seat;
    }

    public String getName() {
        return name;
    }

    public Hand getHand() {
        return hand;
    }

    public int getTotalScore() {
        return totalScore;
    }

    public int getRoundScore() {
        return roundScore;
    }

    public RoundStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean hasBusted() {
        return status == RoundStatus.BUSTED;
    }

    public boolean hasSecondChance() {
        return secondChance;
    }

    public boolean hasFlipThreePending() {
        return flipThreePending;
    }

    public int getBusts() {
        return busts;
    }

    public int getFlip7s() {
        return flip7s;
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
