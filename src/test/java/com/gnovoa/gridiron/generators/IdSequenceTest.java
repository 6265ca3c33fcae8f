package com.gnovoa.gridiron.generators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IdSequenceTest {

    @Test
    @DisplayName("A new sequence starts at one")
    void startsAtOne() {
        IdSequence ids = new IdSequence("coach");

        assertThat(ids.next()).isEqualTo("coach-1");
        assertThat(ids.next()).isEqualTo("coach-2");
    }

    @Test
    @DisplayName("A continuing sequence picks up after the highest numeric id with its prefix")
    void continuesAfterExistingIds() {
        IdSequence ids = IdSequence.continuing("player", List.of("player-3", "player-41", "player-7", "prospect-900"));

        assertThat(ids.next()).isEqualTo("player-42");
    }

    @Test
    @DisplayName("Ids that are not prefix-number are ignored")
    void ignoresForeignIds() {
        IdSequence ids = IdSequence.continuing("player", List.of("player-x1", "player-", "players-5", "player-99999999999999999999"));

        assertThat(ids.next()).isEqualTo("player-1");
        assertThat(ids.prefix()).isEqualTo("player");
    }
}
