/*
 * Where: Analytics service layer
 * What: Maps a stored win_type code to a typed win condition and winning faction
 */
package com.example.analytics.service;

import com.example.common.game.WinCondition;
import com.example.common.game.WinningFaction;
import org.springframework.stereotype.Component;

@Component
public class OutcomeClassifier {

  public WinCondition classify(int winType) {
    return WinCondition.fromCode(winType);
  }

  /** UNKNOWN yields {@link WinningFaction#DEFAULTED_CREWMATE}, never an exception. */
  public WinningFaction winningFaction(WinCondition condition) {
    return condition == null ? WinningFaction.DEFAULTED_CREWMATE : condition.winningFaction();
  }
}
