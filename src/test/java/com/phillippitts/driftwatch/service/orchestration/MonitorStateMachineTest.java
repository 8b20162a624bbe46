package com.phillippitts.driftwatch.service.orchestration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitorStateMachineTest {

    @Test
    void startsIdle() {
        assertThat(new MonitorStateMachine().current()).isEqualTo(MonitorState.IDLE);
    }

    @Test
    void followsWaitingActiveDrainingStopped() {
        MonitorStateMachine sm = new MonitorStateMachine();

        assertThat(sm.transitionTo(MonitorState.WAITING)).isTrue();
        assertThat(sm.transitionTo(MonitorState.ACTIVE)).isTrue();
        assertThat(sm.transitionTo(MonitorState.WAITING)).isTrue();
        assertThat(sm.transitionTo(MonitorState.ACTIVE)).isTrue();
        assertThat(sm.transitionTo(MonitorState.DRAINING)).isTrue();
        assertThat(sm.transitionTo(MonitorState.STOPPED)).isTrue();
        assertThat(sm.isStopped()).isTrue();
    }

    @Test
    void stoppedIsTerminal() {
        MonitorStateMachine sm = new MonitorStateMachine();
        sm.transitionTo(MonitorState.DRAINING);
        sm.transitionTo(MonitorState.STOPPED);

        for (MonitorState target : MonitorState.values()) {
            assertThat(sm.transitionTo(target)).isFalse();
        }
        assertThat(sm.current()).isEqualTo(MonitorState.STOPPED);
    }

    @Test
    void rejectsSkippingDraining() {
        MonitorStateMachine sm = new MonitorStateMachine();
        sm.transitionTo(MonitorState.ACTIVE);

        assertThat(sm.transitionTo(MonitorState.STOPPED)).isFalse();
        assertThat(sm.transitionTo(MonitorState.IDLE)).isFalse();
        assertThat(sm.current()).isEqualTo(MonitorState.ACTIVE);
    }

    @Test
    void drainingOnlyLeadsToStopped() {
        MonitorStateMachine sm = new MonitorStateMachine();
        sm.transitionTo(MonitorState.DRAINING);

        assertThat(sm.transitionTo(MonitorState.ACTIVE)).isFalse();
        assertThat(sm.transitionTo(MonitorState.WAITING)).isFalse();
        assertThat(sm.transitionTo(MonitorState.DRAINING)).isFalse();
    }

    @Test
    void rejectsNullTarget() {
        assertThatThrownBy(() -> new MonitorStateMachine().transitionTo(null))
                .isInstanceOf(NullPointerException.class);
    }
}
