///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads ARFF text into an {@link ArffDataset}.
 * <p>
 * The text is read line by line by a state machine with three states:
 * </p>
 * <ol>
 * <li><b>comment</b>: lines that start with {@code %} are collected into the relation's comment.  The first line that
 * doesn't start with {@code %} ends the comment and is handled in the header state.</li>
 * <li><b>header</b>: {@code @relation}, {@code @attribute}, and {@code @data} directives are recognized without regard
 * to case.  Any other line is ignored.  {@code @data} moves to the data state.</li>
 * <li><b>data</b>: every remaining line that isn't blank or a comment is a row.  Rows that start with <code>{</code> are
 * sparse; all others are dense.</li>
 * </ol>
 * <p>
 * A dense row with the wrong number of values is logged as a warning and skipped.  All other problems throw an
 * {@link ArffFormatException} that names the offending line.
 * </p>
 */
public final class ArffParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArffParser.class);

    private static final String COMMENT_MARKER = "%";

    private static final Pattern ATTRIBUTE_TOKEN = Pattern.compile(
        "[a-zA-Z_][a-zA-Z0-9_\\-\\[\\]]*|\\{[^}]*\\}|'[^']+'|\"[^\"]+\"");

    private static final Pattern QUOTES = Pattern.compile("^['\"]|['\"]$");

    // a comma that isn't escaped and isn't inside a double-quoted value
    private static final Pattern SPARSE_SEPARATOR = Pattern.compile("(?<!\\\\),(?=(?:[^\"]*\"[^\"]*\")*[^\"]*$)");

    private static final Pattern SPARSE_ENTRY = Pattern.compile("([0-9]+)\\s+(.*)");

    enum State {
        COMMENT,
        HEADER,
        DATA,
    }

    /**
     * A builder class for {@link ArffParser}.
     */
    public final static class Builder {
        private boolean schemaOnly;

        private Builder() {
            this.schemaOnly = false;
        }

        /**
         * Sets whether to stop reading at the {@code @data} directive.
         *
         * @param schemaOnly
         *     {@code true} to read only the header; {@code false} to also read the rows.
         *
         * @return This builder
         */
        public Builder schemaOnly(boolean schemaOnly) {
            this.schemaOnly = schemaOnly;
            return this;
        }

        /**
         * Builds the parser.
         *
         * @return An {@code ArffParser}
         */
        public ArffParser build() {
            return new ArffParser(schemaOnly);
        }
    }

    /**
     * Creates a new ArffParser builder that reads both header and rows.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private final boolean schemaOnly;

    private ArffParser(boolean schemaOnly) {
        this.schemaOnly = schemaOnly;
    }

    /**
     * Parses ARFF text.
     *
     * @param text
     *     The ARFF text.
     *
     * @return A new dataset.
     *
     * @throws ArffFormatException
     *     if the text is malformed.
     */
    public ArffDataset parse(String text) {
        ArgumentUtil.checkNotNull(text, "text");
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringReader doesn't throw IOException
        }
    }

    /**
     * Parses ARFF text from a reader.  The reader is not closed.
     *
     * @param reader
     *     The source of the ARFF text.
     *
     * @return A new dataset.
     *
     * @throws IOException
     *     if the text couldn't be read.
     * @throws ArffFormatException
     *     if the text is malformed.
     */
    public ArffDataset parse(Reader reader) throws IOException {
        ArgumentUtil.checkNotNull(reader, "reader");
        ArffDataset dataset = new ArffDataset();
        new Session(dataset, State.COMMENT).parse(reader);
        return dataset;
    }

    /**
     * Reads an ARFF file.
     *
     * @param sourceLocation
     *     The file to read.  It must be encoded in UTF-8.
     *
     * @return A new dataset.
     *
     * @throws IOException
     *     if the file couldn't be read.
     * @throws ArffFormatException
     *     if the file is malformed.
     */
    public ArffDataset load(Path sourceLocation) throws IOException {
        ArgumentUtil.checkNotNull(sourceLocation, "sourceLocation");
        try (Reader reader = Files.newBufferedReader(sourceLocation, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses additional data lines into an existing dataset.
     *
     * @param dataset
     *     The dataset that receives the rows.
     * @param lines
     *     Dense or sparse rows, one per line.  Comment lines are ignored.
     *
     * @throws ArffFormatException
     *     if a line is malformed.
     */
    void parseData(ArffDataset dataset, String lines) {
        try {
            new Session(dataset, State.DATA).parse(new StringReader(lines));
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringReader doesn't throw IOException
        }
    }

    /** The state of parsing a single text into a single dataset. */
    private final class Session {
        private final ArffDataset dataset;
        private final List<String> commentLines;
        private State state;
        private int lineNumber;

        Session(ArffDataset dataset, State initialState) {
            this.dataset = dataset;
            this.commentLines = new ArrayList<>();
            this.state = initialState;
            this.lineNumber = 0;
        }

        void parse(Reader reader) throws IOException {
            BufferedReader lineReader = new BufferedReader(reader);
            String line;
            while ((line = lineReader.readLine()) != null) {
                lineNumber++;
                parseLine(line);
                if (schemaOnly && state == State.DATA) {
                    break;
                }
            }
            if (state == State.COMMENT) {
                endComment(); // the text had nothing but comments
            }
        }

        void parseLine(String line) {
            switch (state) {
            case COMMENT:
                if (line.startsWith(COMMENT_MARKER)) {
                    String text = line.substring(COMMENT_MARKER.length());
                    commentLines.add(text.startsWith(" ") ? text.substring(1) : text);
                } else {
                    endComment();
                    parseLine(line);
                }
                break;

            case HEADER:
                parseHeaderLine(line);
                break;

            case DATA:
                if (!line.isBlank() && !line.startsWith(COMMENT_MARKER)) {
                    parseRow(line.strip());
                }
                break;

            default:
                throw new AssertionError("unhandled state " + state);
            }
        }

        private void endComment() {
            dataset.schema().setComment(String.join("\n", commentLines));
            state = State.HEADER;
        }

        private void parseHeaderLine(String line) {
            String lowerCaseLine = line.toLowerCase(Locale.ROOT);
            if (lowerCaseLine.startsWith("@relation ")) {
                String[] tokens = line.strip().split("\\s+");
                if (tokens.length < 2) {
                    throw new ArffFormatException(lineNumber, "missing relation name");
                }
                dataset.schema().setRelation(tokens[1]);
            } else if (lowerCaseLine.startsWith("@attribute ")) {
                parseAttribute(line);
            } else if (lowerCaseLine.startsWith("@data")) {
                state = State.DATA;
            } else if (line.startsWith("@")) {
                LOGGER.debug("ignoring unknown directive on line {}: {}", lineNumber, line);
            }
        }

        private void parseAttribute(String line) {
            List<String> tokens = new ArrayList<>();
            Matcher matcher = ATTRIBUTE_TOKEN.matcher(line);
            while (matcher.find()) {
                tokens.add(matcher.group().strip());
            }
            // tokens.get(0) is "attribute" from the "@attribute" directive
            if (tokens.size() < 3) {
                throw new ArffFormatException(lineNumber, "malformed attribute declaration: " + line);
            }

            String name = stripQuotes(tokens.get(1));
            String typeToken = tokens.get(2);

            Attribute.Builder builder = Attribute.builder().name(name);
            AttributeType type = AttributeType.forKeyword(typeToken);
            if (type != null) {
                builder.type(type);
                if (type == AttributeType.DATE && 4 <= tokens.size()) {
                    builder.datePattern(stripQuotes(tokens.get(3)));
                }
            } else if (typeToken.startsWith("{") && typeToken.endsWith("}")) {
                List<String> values = Arrays.stream(typeToken.substring(1, typeToken.length() - 1).split(",")).
                    map(String::strip).
                    filter(value -> !value.isEmpty()).
                    collect(Collectors.toList());
                builder.type(AttributeType.NOMINAL).nominalValues(values);
            } else {
                throw new ArffFormatException(
                    lineNumber, "Unsupported type " + typeToken + " for attribute " + name + ".");
            }

            try {
                dataset.defineAttribute(builder.build());
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new ArffFormatException(lineNumber, e.getMessage(), e);
            }
        }

        private void parseRow(String line) {
            if (line.startsWith("{")) {
                parseSparseRow(line);
            } else {
                parseDenseRow(line);
            }
        }

        private void parseSparseRow(String line) {
            if (!line.endsWith("}")) {
                throw new ArffFormatException(lineNumber, "Malformed sparse data line: " + line);
            }
            if (dataset.isStreaming()) {
                throw new IllegalStateException("sparse rows cannot be parsed into a dataset that is streaming");
            }

            List<Attribute> attributes = dataset.schema().attributes();
            Map<String, Value> fields = new LinkedHashMap<>();
            String interior = line.substring(1, line.length() - 1);
            if (!interior.isBlank()) {
                for (String part : SPARSE_SEPARATOR.split(interior, -1)) {
                    Matcher matcher = SPARSE_ENTRY.matcher(part.strip());
                    if (!matcher.matches()) {
                        throw new ArffFormatException(lineNumber, "Malformed sparse entry \"" + part.strip() + "\"");
                    }

                    final int index;
                    try {
                        index = Integer.parseInt(matcher.group(1));
                    } catch (NumberFormatException e) {
                        throw new ArffFormatException(lineNumber, "Sparse index " + matcher.group(1) + " is too large", e);
                    }
                    if (attributes.size() <= index) {
                        throw new ArffFormatException(
                            lineNumber,
                            "Sparse index " + index + " is out of range for " + attributes.size() + " attribute(s)");
                    }

                    String text = matcher.group(2);
                    if (2 <= text.length() && text.charAt(0) == text.charAt(text.length() - 1) &&
                        (text.charAt(0) == '"' || text.charAt(0) == '\'')) {
                        text = text.substring(1, text.length() - 1);
                    }

                    Attribute attribute = attributes.get(index);
                    try {
                        fields.put(
                            attribute.name(),
                            Value.MISSING.equals(text) ? Value.string(text) : Value.of(attribute.type(), text, false));
                    } catch (IllegalArgumentException e) {
                        throw new ArffFormatException(lineNumber, e.getMessage(), e);
                    }
                }
            }
            dataset.addRow(Row.sparse(fields));
        }

        private void parseDenseRow(String line) {
            List<String> cells = Arrays.stream(line.split(",", -1)).map(String::strip).collect(Collectors.toList());
            int totalAttributes = dataset.schema().size();
            if (cells.size() != totalAttributes) {
                LOGGER.warn(
                    "line {} contains {} values but it should contain {} values",
                    lineNumber,
                    cells.size(),
                    totalAttributes);
                return;
            }

            try {
                dataset.addRow(dataset.toDenseRow(cells));
            } catch (IllegalArgumentException e) {
                throw new ArffFormatException(lineNumber, e.getMessage(), e);
            }
        }
    }

    static String stripQuotes(String text) {
        return QUOTES.matcher(text).replaceAll("");
    }
}
