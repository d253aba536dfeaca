package ru.javaboys.huntysourcing.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;
import ru.javaboys.huntysourcing.service.DocParseService;

import java.io.IOException;
import java.io.InputStream;

/**
 * Turns an uploaded job description (PDF, DOCX, TXT...) into plain text.
 */
@Service
@Slf4j
public class DocParseServiceImpl implements DocParseService {

    private final int maxChars;

    public DocParseServiceImpl(@Value("${hunty.docs.max-chars:100000}") int maxChars) {
        this.maxChars = maxChars;
    }

    @Override
    public String parseToText(InputStream is, @Nullable String originalName) {
        AutoDetectParser parser = new AutoDetectParser();
        // обрезаем длинные документы: при достижении лимита хендлер бросает исключение, текст сохраняется
        BodyContentHandler handler = new BodyContentHandler(maxChars);
        Metadata metadata = new Metadata();

        if (originalName != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, originalName);
        }

        try {
            parser.parse(is, handler, metadata, new ParseContext());
            return TextNormalizer.collapseWhitespace(handler.toString());
        } catch (SAXException | TikaException e) {
            if (!WriteLimitReachedException.isWriteLimitReached(e)) {
                log.error("Failed to parse stream (name={})", originalName, e);
                throw new IllegalStateException("Unable to parse document to text", e);
            }
            log.warn("Document {} exceeds {} chars, keeping the first part", originalName, maxChars);
            return TextNormalizer.collapseWhitespace(handler.toString());
        } catch (IOException e) {
            log.error("Failed to read stream (name={})", originalName, e);
            throw new IllegalStateException("Unable to read document", e);
        }
    }
}
