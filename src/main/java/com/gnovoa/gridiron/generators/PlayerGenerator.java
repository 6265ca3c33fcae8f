package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.model.Player;

import java.util.List;

/** Creates structurally valid players: unique ids, known positions, rookie minimum age. */
public interface PlayerGenerator {

    Player generatePlayer(PlayerConstraints constraints);

    /** A full 53-man roster covering every position's ideal depth. Players are unsigned. */
    List<Player> generateRoster(String teamId);
}
