package com.peoplescourt.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordQuerySanitizerTest {

    private final KeywordQuerySanitizer sanitizer = new KeywordQuerySanitizer();

    @Test
    void keepsOnlyFirstLine() {
        assertThat(sanitizer.sanitize("My roommate ate my food\nand then lied about it"))
                .isEqualTo("My roommate ate my food");
    }

    @Test
    void replacesQuerySyntaxWithSpaces() {
        assertThat(sanitizer.sanitize("WIBTA (28F) for saying: \"no\"?"))
                .isEqualTo("WIBTA  28F  for saying   no");
    }

    @Test
    void stripsSlashesStarsAndDashes() {
        assertThat(sanitizer.sanitize("sister-in-law/boyfriend*"))
                .isEqualTo("sister in law boyfriend");
    }

    @Test
    void blankOrNullBecomesEmpty() {
        assertThat(sanitizer.sanitize(null)).isEmpty();
        assertThat(sanitizer.sanitize("  ?? \nsecond line")).isEmpty();
        assertThat(sanitizer.sanitize("\r\nonly the second line")).isEmpty();
    }
}
