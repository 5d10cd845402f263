package com.fourpaws.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import com.fourpaws.backend.modules.animal.domain.Animal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();
    private final MockHttpServletRequest request =
            new MockHttpServletRequest("POST", "/api/v1/organizations/x/animals/y/transitions");

    @Test
    @DisplayName("a deadlock or lock timeout answers 409 with the retryable code")
    void lockConflictsAreRetryable() {
        assertRetryableConflict(handler.handleConcurrencyFailure(
                new CannotAcquireLockException("deadlock detected"), request));
        assertRetryableConflict(handler.handleConcurrencyFailure(
                new PessimisticLockingFailureException("could not obtain lock"), request));
    }

    @Test
    void staleVersionsNameTheEntity() {
        ResponseEntity<ProblemResponse> response = handler.handleConcurrencyFailure(
                new ObjectOptimisticLockingFailureException(Animal.class, UUID.randomUUID()), request);

        assertRetryableConflict(response);
        assertThat(response.getBody().detail()).contains("Animal");
    }

    private static void assertRetryableConflict(ResponseEntity<ProblemResponse> response) {
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("0");
        ProblemResponse body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.code()).isEqualTo(ErrorCode.CONCURRENT_MODIFICATION.name());
        assertThat(body.status()).isEqualTo(409);
        assertThat(body.instance()).isEqualTo("/api/v1/organizations/x/animals/y/transitions");
    }

    @Test
    void handlerCoversEveryConcurrencyFailure() {
        ConcurrencyFailureException generic = new ConcurrencyFailureException("row changed underneath");

        assertRetryableConflict(handler.handleConcurrencyFailure(generic, request));
    }
}
