package co.fanki.callgraphmcp.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Preconditions}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequiringNonBlank_givenBlank_shouldThrowWithMessage() {
        final IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank(" ", "name is required"));

        assertEquals("name is required", e.getMessage());
    }

    @Test
    void whenRequiringNonNull_givenValue_shouldReturnIt() {
        assertEquals("x", Preconditions.requireNonNull("x", "unused"));
    }

    @Test
    void whenRequiringFunctionName_givenPaddedName_shouldStripIt() {
        assertEquals("Account::deposit",
                Preconditions.requireFunctionName("  Account::deposit\n"));
    }

    @Test
    void whenRequiringFunctionName_givenBlank_shouldThrowInvalidArgument() {
        final DomainException e = assertThrows(DomainException.class,
                () -> Preconditions.requireFunctionName("\t"));

        assertEquals(DomainException.INVALID_ARGUMENT, e.getErrorCode());
    }

}
