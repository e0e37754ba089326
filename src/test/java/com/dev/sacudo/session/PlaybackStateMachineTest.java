package com.dev.sacudo.session;

import com.dev.sacudo.domain.PlaybackState;
import com.dev.sacudo.session.PlaybackStateMachine.Trigger;
import com.dev.sacudo.web.InvalidStateException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlaybackStateMachineTest {

    @Test
    void startsDisconnected() {
        assertThat(new PlaybackStateMachine().getState()).isEqualTo(PlaybackState.DISCONNECTED);
    }

    @Test
    void followsJoinPlayPauseResumeStop() {
        PlaybackStateMachine machine = new PlaybackStateMachine();

        machine.fire(Trigger.JOIN, PlaybackState.CONNECTING);
        machine.fire(Trigger.JOIN_SUCCEEDED, PlaybackState.IDLE);
        machine.fire(Trigger.PLAY, PlaybackState.PLAYING);
        machine.fire(Trigger.PAUSE, PlaybackState.PAUSED);
        machine.fire(Trigger.RESUME, PlaybackState.PLAYING);
        machine.fire(Trigger.STOP, PlaybackState.IDLE);

        assertThat(machine.getState()).isEqualTo(PlaybackState.IDLE);
    }

    @Test
    void pauseOutsidePlayingIsRejected() {
        PlaybackStateMachine machine = connected();

        assertThatThrownBy(() -> machine.fire(Trigger.PAUSE, PlaybackState.PAUSED))
                .isInstanceOfSatisfying(InvalidStateException.class,
                        e -> assertThat(e.getState()).isEqualTo(PlaybackState.IDLE))
                .hasMessage("Nothing is playing");
        assertThat(machine.getState()).isEqualTo(PlaybackState.IDLE);
    }

    @Test
    void resumeOutsidePausedIsRejected() {
        PlaybackStateMachine machine = connected();
        machine.fire(Trigger.PLAY, PlaybackState.PLAYING);

        assertThatThrownBy(() -> machine.check(Trigger.RESUME)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void skipFromPausedMayPlayOrIdle() {
        PlaybackStateMachine machine = connected();
        machine.fire(Trigger.PLAY, PlaybackState.PLAYING);
        machine.fire(Trigger.PAUSE, PlaybackState.PAUSED);

        machine.fire(Trigger.SKIP, PlaybackState.IDLE);

        assertThat(machine.getState()).isEqualTo(PlaybackState.IDLE);
        assertThat(machine.canFire(Trigger.SKIP)).isFalse();
    }

    @Test
    void triggerCannotReachUnlistedState() {
        PlaybackStateMachine machine = connected();

        assertThatThrownBy(() -> machine.fire(Trigger.PLAY, PlaybackState.PAUSED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stopIsNotAvailableWithoutVoice() {
        PlaybackStateMachine machine = new PlaybackStateMachine();

        assertThat(machine.canFire(Trigger.STOP)).isFalse();
        assertThat(machine.canFire(Trigger.LEAVE)).isTrue();
    }

    @Test
    void transportLossDisconnectsFromAnyConnectedState() {
        for (PlaybackState from : new PlaybackState[]{PlaybackState.IDLE, PlaybackState.PLAYING, PlaybackState.PAUSED}) {
            assertThat(Trigger.TRANSPORT_LOST.isAllowedFrom(from)).isTrue();
        }
        assertThat(Trigger.TRANSPORT_LOST.isAllowedFrom(PlaybackState.DISCONNECTED)).isFalse();
    }

    private static PlaybackStateMachine connected() {
        PlaybackStateMachine machine = new PlaybackStateMachine();
        machine.fire(Trigger.JOIN, PlaybackState.CONNECTING);
        machine.fire(Trigger.JOIN_SUCCEEDED, PlaybackState.IDLE);
        return machine;
    }
}
