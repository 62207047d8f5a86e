package defiautomation.signer.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LogSanitizer Tests")
class LogSanitizerTest {

    @Nested
    @DisplayName("sanitize Tests")
    class SanitizeTests {

        @Test
        @DisplayName("Should return empty string for null input")
        void shouldReturnEmptyForNull() {
            assertEquals("", LogSanitizer.sanitize(null));
        }

        @Test
        @DisplayName("Should collapse control characters into one underscore")
        void shouldReplaceControlChars() {
            assertEquals("a_b_c", LogSanitizer.sanitize("a\n\r\tb\t\n\rc"));
        }

        @Test
        @DisplayName("Should neutralize a forged log line")
        void shouldPreventLogInjection() {
            String sanitized = LogSanitizer.sanitize("owner-1\n[ERROR] key leaked");
            assertFalse(sanitized.contains("\n"));
            assertEquals("owner-1_[ERROR] key leaked", sanitized);
        }

        @Test
        @DisplayName("Should replace escape and NUL characters")
        void shouldReplaceOtherControlChars() {
            assertEquals("erc20_approve_x", LogSanitizer.sanitize("erc20\u001bapprove\u0000x"));
        }

        @Test
        @DisplayName("Should truncate oversized values and report their length")
        void shouldTruncateLongValues() {
            String sanitized = LogSanitizer.sanitize("a".repeat(500));

            assertEquals("a".repeat(200) + "...(500 chars)", sanitized);
        }
    }

    @Nested
    @DisplayName("maskIdentifier Tests")
    class MaskIdentifierTests {

        @Test
        @DisplayName("Should keep four hex digits at each end of an address")
        void shouldMaskAddress() {
            assertEquals("0xf39F...2266", LogSanitizer.maskIdentifier("0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266"));
        }

        @Test
        @DisplayName("Should reduce a KMS key ARN to its masked key id")
        void shouldMaskKmsArn() {
            assertEquals("1234...90ab", LogSanitizer.maskIdentifier(
                "arn:aws:kms:us-east-1:111122223333:key/1234abcd-12ab-34cd-56ef-1234567890ab"));
        }

        @Test
        @DisplayName("Should mask wallet ids and owner references")
        void shouldMaskIds() {
            assertEquals("3f2a...c9d1", LogSanitizer.maskIdentifier("3f2a7b10-5c6d-4e8f-9a0b-1c2d3e4fc9d1"));
            assertEquals("u***", LogSanitizer.maskIdentifier("user-1"));
        }

        @Test
        @DisplayName("Should hide very short identifiers entirely")
        void shouldMaskShortIdentifiers() {
            assertEquals("", LogSanitizer.maskIdentifier(null));
            assertEquals("***", LogSanitizer.maskIdentifier("a"));
            assertEquals("***", LogSanitizer.maskIdentifier("abcd"));
        }
    }

    @Nested
    @DisplayName("describe Tests")
    class DescribeTests {

        @Test
        @DisplayName("Should fall back to the class name without a message")
        void shouldFallBackToClassName() {
            assertEquals("IllegalStateException", LogSanitizer.describe(new IllegalStateException()));
        }

        @Test
        @DisplayName("Should sanitize the message")
        void shouldSanitizeMessage() {
            assertEquals("bad_input", LogSanitizer.describe(new IllegalArgumentException("bad\ninput")));
            assertEquals("", LogSanitizer.describe(null));
        }
    }
}
