package com.shiptivity.board.application.service;

import com.shiptivity.board.application.port.ClientPort;
import com.shiptivity.board.core.exception.InvalidIdException;
import com.shiptivity.board.core.exception.InvalidLaneException;
import com.shiptivity.board.core.exception.InvalidPriorityException;
import com.shiptivity.board.core.model.Client;
import com.shiptivity.board.core.model.Lane;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClientValidatorTest {

    @Mock
    private ClientPort clientPort;

    private ClientValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ClientValidator(clientPort);
    }

    @Nested
    @DisplayName("Id validation")
    class IdTests {

        @Test
        @DisplayName("Existing id is accepted")
        void acceptsExistingId() {
            when(clientPort.findById(7L)).thenReturn(new Client(7, "Runolfsson", null, Lane.BACKLOG, 3));

            assertThat(validator.validateId("7")).isEqualTo(7L);
        }

        @Test
        @DisplayName("Non-integer id is rejected")
        void rejectsNonInteger() {
            assertThatThrownBy(() -> validator.validateId("seven"))
                    .isInstanceOf(InvalidIdException.class)
                    .extracting(ex -> ((InvalidIdException) ex).getReason())
                    .isEqualTo(InvalidIdException.Reason.NOT_AN_INTEGER);
            verify(clientPort, never()).findById(anyLong());
        }

        @Test
        @DisplayName("Decimal id is rejected")
        void rejectsDecimal() {
            assertThatThrownBy(() -> validator.validateId("1.5"))
                    .isInstanceOf(InvalidIdException.class);
        }

        @Test
        @DisplayName("Unknown id is rejected")
        void rejectsUnknownId() {
            when(clientPort.findById(404L)).thenReturn(null);

            assertThatThrownBy(() -> validator.validateId("404"))
                    .isInstanceOf(InvalidIdException.class)
                    .extracting(ex -> ((InvalidIdException) ex).getReason())
                    .isEqualTo(InvalidIdException.Reason.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("Priority validation")
    class PriorityTests {

        @Test
        @DisplayName("Absent priority is valid")
        void absentPriorityIsValid() {
            assertThat(validator.validatePriority(null)).isNull();
            assertThat(validator.validatePriority("")).isNull();
        }

        @Test
        @DisplayName("Positive integer is accepted")
        void acceptsPositiveInteger() {
            assertThat(validator.validatePriority("3")).isEqualTo(3);
        }

        @Test
        @DisplayName("Priority beyond int range is capped for clamping")
        void capsPriorityBeyondIntRange() {
            assertThat(validator.validatePriority("2147483648")).isEqualTo(Integer.MAX_VALUE);
            assertThat(validator.validatePriority("99999999999999999999999")).isEqualTo(Integer.MAX_VALUE);
        }

        @Test
        @DisplayName("Negative priority beyond int range is rejected")
        void rejectsNegativeBeyondIntRange() {
            assertThatThrownBy(() -> validator.validatePriority("-2147483649"))
                    .isInstanceOf(InvalidPriorityException.class);
        }

        @Test
        @DisplayName("Zero priority is rejected")
        void rejectsZero() {
            assertThatThrownBy(() -> validator.validatePriority("0"))
                    .isInstanceOf(InvalidPriorityException.class);
        }

        @Test
        @DisplayName("Negative priority is rejected")
        void rejectsNegative() {
            assertThatThrownBy(() -> validator.validatePriority("-2"))
                    .isInstanceOf(InvalidPriorityException.class);
        }

        @Test
        @DisplayName("Non-integer priority is rejected")
        void rejectsNonInteger() {
            assertThatThrownBy(() -> validator.validatePriority("1.5"))
                    .isInstanceOf(InvalidPriorityException.class);
            assertThatThrownBy(() -> validator.validatePriority("high"))
                    .isInstanceOf(InvalidPriorityException.class);
        }
    }

    @Nested
    @DisplayName("Lane validation")
    class LaneTests {

        @Test
        @DisplayName("Absent lane is valid")
        void absentLaneIsValid() {
            assertThat(validator.validateLane(null)).isNull();
        }

        @Test
        @DisplayName("Wire values resolve to lanes")
        void resolvesWireValues() {
            assertThat(validator.validateLane("backlog")).isEqualTo(Lane.BACKLOG);
            assertThat(validator.validateLane("in-progress")).isEqualTo(Lane.IN_PROGRESS);
            assertThat(validator.validateLane("complete")).isEqualTo(Lane.COMPLETE);
        }

        @Test
        @DisplayName("Unknown lane is rejected")
        void rejectsUnknownLane() {
            assertThatThrownBy(() -> validator.validateLane("IN_PROGRESS"))
                    .isInstanceOf(InvalidLaneException.class);
            assertThatThrownBy(() -> validator.validateLane("done"))
                    .isInstanceOf(InvalidLaneException.class);
        }
    }
}
