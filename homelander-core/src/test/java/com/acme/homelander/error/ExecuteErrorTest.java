package com.acme.homelander.error;

import com.acme.homelander.traits.LockUnlock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ExecuteErrorTest {

    @Test
    @DisplayName("from - should keep the error of a domain failure")
    void testFromDomainError() {
        ExecuteError error = ExecuteError.from(LockUnlock.ErrorCode.ALREADY_LOCKED.toException());

        assertThat(error).isInstanceOf(ExecuteError.Serializable.class);
        assertThat(((ExecuteError.Serializable) error).error().errorCode()).isEqualTo("alreadyLocked");
    }

    @Test
    @DisplayName("from - should classify infrastructure failures as server faults")
    void testFromInfrastructureFailure() {
        ExecuteError error = ExecuteError.from(new InfrastructureException("bus timeout"));

        assertThat(error).isEqualTo(new ExecuteError.Server("bus timeout"));
    }

    @Test
    @DisplayName("from - should fall back to the exception type when there is no message")
    void testFromWithoutMessage() {
        ExecuteError error = ExecuteError.from(new NullPointerException());

        assertThat(error).isEqualTo(new ExecuteError.Server("NullPointerException"));
    }

    @Test
    @DisplayName("toException - should carry the error code as message")
    void testToException() {
        DomainErrorException e = DeviceErrorCode.DEVICE_OFFLINE.toException();

        assertThat(e.getMessage()).isEqualTo("deviceOffline");
        assertThat(e.error()).isSameAs(DeviceErrorCode.DEVICE_OFFLINE);
    }
}
