package org.dxdomain.analyzer.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/*
Reads the analyzer keys from .editorconfig-style text.

Section headers are accepted but not interpreted: all keys end up in one snapshot, later ones win.
The parser is lenient; lines that are not 'key = value' are skipped.
 */
public class EditorConfigParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(EditorConfigParser.class);

    public AnalyzerConfigOptions parse(String content) {
        Map<String, String> values = new LinkedHashMap<>();
        int lineNumber = 0;
        for (String rawLine : content.split("\\R")) {
            ++lineNumber;
            String line = rawLine.trim();
            if (line.isEmpty() || line.charAt(0) == '#' || line.charAt(0) == ';') continue;
            if (line.charAt(0) == '[') {
                LOGGER.debug("Section {} at line {}", line, lineNumber);
                continue;
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                LOGGER.debug("Skipping malformed line {}: {}", lineNumber, line);
                continue;
            }
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            if ("root".equals(key)) continue;
            values.put(key, value);
        }
        return AnalyzerConfigOptions.of(values);
    }

    public AnalyzerConfigOptions parse(Path path) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read analyzer configuration " + path, e);
        }
    }
}
