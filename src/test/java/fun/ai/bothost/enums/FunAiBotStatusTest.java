package fun.ai.bothost.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FunAiBotStatusTest {

    @Test
    void testDeployLifecycleTransitions() {
        assertEquals(FunAiBotStatus.DEPLOYING, FunAiBotStatus.STOPPED.transitionTo(FunAiBotStatus.DEPLOYING));
        assertEquals(FunAiBotStatus.STOPPED, FunAiBotStatus.DEPLOYING.transitionTo(FunAiBotStatus.STOPPED));
        assertEquals(FunAiBotStatus.ERROR, FunAiBotStatus.DEPLOYING.transitionTo(FunAiBotStatus.ERROR));
    }

    @Test
    void testRunLifecycleTransitions() {
        assertTrue(FunAiBotStatus.STOPPED.canTransitionTo(FunAiBotStatus.RUNNING));
        assertTrue(FunAiBotStatus.RUNNING.canTransitionTo(FunAiBotStatus.STOPPED));
        assertTrue(FunAiBotStatus.RUNNING.canTransitionTo(FunAiBotStatus.ERROR));
        assertTrue(FunAiBotStatus.ERROR.canTransitionTo(FunAiBotStatus.RUNNING));
        // 自动重启失败
        assertTrue(FunAiBotStatus.ERROR.canTransitionTo(FunAiBotStatus.ERROR));
    }

    @Test
    void testIllegalTransitions() {
        // 运行中不能重复运行，也不能直接部署
        assertThrows(IllegalStateException.class, () -> FunAiBotStatus.RUNNING.transitionTo(FunAiBotStatus.RUNNING));
        assertThrows(IllegalStateException.class, () -> FunAiBotStatus.RUNNING.transitionTo(FunAiBotStatus.DEPLOYING));
        // 部署成功只能落到 STOPPED
        assertThrows(IllegalStateException.class, () -> FunAiBotStatus.DEPLOYING.transitionTo(FunAiBotStatus.RUNNING));
        assertThrows(IllegalStateException.class, () -> FunAiBotStatus.DEPLOYING.transitionTo(FunAiBotStatus.DEPLOYING));
        assertFalse(FunAiBotStatus.STOPPED.canTransitionTo(null));
    }
}
