package com.ivyintel.tracker.scrape.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentFingerprinterTest {

    private static final String PAGE =
        "<html><script>x()</script><body>  Tuition $60,000  Fees $2,000 </body></html>";

    @Test
    void scriptBlocksDoNotAffectFingerprint() {
        String withoutScript = "<html><body>  Tuition $60,000  Fees $2,000 </body></html>";

        assertThat(ContentFingerprinter.fingerprint(PAGE))
            .isEqualTo(ContentFingerprinter.fingerprint(withoutScript));
    }

    @Test
    void styleBlocksAndMultilineScriptsAreStrippedCaseInsensitively() {
        String noisy = """
            <html>
              <STYLE type="text/css">
                body { color: red; }
              </STYLE>
              <Script src="analytics.js">
                track("visit", Date.now());
              </sCRIPT>
              <body>Hello</body>
            </html>
            """;
        String clean = "<html> <body>Hello</body> </html>";

        assertThat(ContentFingerprinter.fingerprint(noisy)).isEqualTo(ContentFingerprinter.fingerprint(clean));
    }

    @Test
    void whitespaceOnlyEditsDoNotChangeFingerprint() {
        String reflowed = "<html><script>x()</script><body>\n\tTuition   $60,000\n\nFees $2,000\n</body></html>";

        assertThat(ContentFingerprinter.fingerprint(reflowed)).isEqualTo(ContentFingerprinter.fingerprint(PAGE));
    }

    @Test
    void visibleTextChangeProducesDifferentFingerprint() {
        String raised = "<html><script>x()</script><body>  Tuition $61,000  Fees $2,000 </body></html>";

        assertThat(ContentFingerprinter.fingerprint(raised)).isNotEqualTo(ContentFingerprinter.fingerprint(PAGE));
    }

    @Test
    void fingerprintIsStableHexSha256() {
        String hash = ContentFingerprinter.fingerprint(PAGE);

        assertThat(hash).hasSize(64).matches("[0-9a-f]+");
        assertThat(ContentFingerprinter.fingerprint(PAGE)).isEqualTo(hash);
        // sha256 of the empty string
        assertThat(ContentFingerprinter.fingerprint(null))
            .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void normalizeCollapsesWhitespaceAndTrims() {
        assertThat(ContentFingerprinter.normalize("  <p>a\n\n b</p>\t")).isEqualTo("<p>a b</p>");
    }
}
