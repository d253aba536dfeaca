package ru.javaboys.huntysourcing.service.impl;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocParseServiceImplTest {

    private static InputStream text(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parseToText_shouldExtractPlainText() {
        DocParseServiceImpl service = new DocParseServiceImpl(100_000);

        String result = service.parseToText(text("Leveraged Finance Associate\n\nNew York,   full time"), "jd.txt");

        assertThat(result).isEqualTo("Leveraged Finance Associate New York, full time");
    }

    @Test
    void parseToText_shouldKeepBeginningOfLongDocuments() {
        DocParseServiceImpl service = new DocParseServiceImpl(10);

        String result = service.parseToText(text("alpha beta gamma delta epsilon zeta eta theta"), "jd.txt");

        assertThat(result).startsWith("alpha").hasSizeLessThanOrEqualTo(10);
    }

    @Test
    void parseToText_shouldWrapReadFailures() {
        DocParseServiceImpl service = new DocParseServiceImpl(100);
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }
        };

        assertThatThrownBy(() -> service.parseToText(broken, "jd.txt")).isInstanceOf(IllegalStateException.class);
    }
}
