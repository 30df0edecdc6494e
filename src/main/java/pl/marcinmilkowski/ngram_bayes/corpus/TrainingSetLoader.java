package pl.marcinmilkowski.ngram_bayes.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a training set described by a tab-separated manifest.
 *
 * Expected manifest structure (exactly 4 lines, cells separated by TAB):
 *
 *   ja_JP.UTF-8
 *   sports	politics	science
 *   train1.txt	train2.txt
 *   validate.txt
 *
 * Line 1 is the locale; its codeset (after '.') selects the charset of the
 * other manifest lines and of the data files. Line 2 lists category labels.
 * Line 3 lists training files, in which line i belongs to category i.
 * Line 4 names the validation file whose rows are "categoryIndex TAB text".
 * File names are resolved against the manifest's directory. Lines end only
 * at LF; CR characters are dropped.
 */
public class TrainingSetLoader {

    private static final Logger logger = LoggerFactory.getLogger(TrainingSetLoader.class);

    private static final int MANIFEST_LINES = 4;

    /**
     * Load the manifest and every file it references.
     *
     * @param manifestPath Path to the manifest file
     * @throws IOException if a file cannot be read
     * @throws ManifestFormatException if the manifest or validation file is malformed
     */
    public TrainingSet load(Path manifestPath) throws IOException {
        // Latin-1 maps every byte to one char, so the locale line can be read
        // before the codeset of the remaining lines is known
        List<String> rawLines = readLines(manifestPath, StandardCharsets.ISO_8859_1);
        if (rawLines.size() != MANIFEST_LINES) {
            throw new ManifestFormatException("CSV format error: expected " + MANIFEST_LINES
                + " lines in " + manifestPath + ", found " + rawLines.size());
        }

        List<String> localeCells = splitCells(rawLines.get(0));
        String localeName = localeCells.isEmpty() ? "" : localeCells.get(0);
        Charset charset = charsetForLocale(localeName);

        List<String> categories = splitCells(recode(rawLines.get(1), charset, manifestPath));
        List<String> trainingFiles = splitCells(recode(rawLines.get(2), charset, manifestPath));
        List<String> validationCells = splitCells(recode(rawLines.get(3), charset, manifestPath));

        if (categories.isEmpty()) {
            throw new ManifestFormatException("CSV format error: no categories in " + manifestPath);
        }
        if (trainingFiles.isEmpty()) {
            throw new ManifestFormatException("CSV format error: no training files in " + manifestPath);
        }
        if (validationCells.isEmpty() || validationCells.get(0).isBlank()) {
            throw new ManifestFormatException("CSV format error: no validation file in " + manifestPath);
        }

        Path baseDir = manifestPath.toAbsolutePath().getParent();

        Map<String, String> trainingTexts = new LinkedHashMap<>();
        for (String fileName : trainingFiles) {
            Map<String, String> fileTexts = readTrainingFile(baseDir.resolve(fileName), charset, categories);
            fileTexts.forEach((category, text) -> trainingTexts.merge(category, text, String::concat));
        }

        List<TrainingSet.ValidationSample> samples =
            readValidationFile(baseDir.resolve(validationCells.get(0)), charset, categories.size());

        logger.info("Loaded training set from {}: locale '{}' ({}), {} categories, {} training files, {} validation samples",
            manifestPath, localeName, charset.name(), categories.size(), trainingFiles.size(), samples.size());

        return new TrainingSet(localeName, charset, categories, orderByCategory(trainingTexts, categories), samples);
    }

    /**
     * Resolve the charset named by a POSIX-style locale ("ja_JP.UTF-8",
     * "en_US.ISO-8859-1@euro") or a Windows one ("Japanese_Japan.932").
     * Falls back to UTF-8 when no codeset is present or it is unknown.
     */
    static Charset charsetForLocale(String localeName) {
        if (localeName == null) {
            return StandardCharsets.UTF_8;
        }
        int dot = localeName.indexOf('.');
        if (dot < 0 || dot == localeName.length() - 1) {
            return StandardCharsets.UTF_8;
        }
        String codeset = localeName.substring(dot + 1);
        int at = codeset.indexOf('@');
        if (at >= 0) {
            codeset = codeset.substring(0, at);
        }

        List<String> candidates = new ArrayList<>();
        candidates.add(codeset);
        if (codeset.chars().allMatch(Character::isDigit)) {
            candidates.add("windows-" + codeset);
            candidates.add("ms" + codeset);
            candidates.add("cp" + codeset);
        }
        for (String candidate : candidates) {
            try {
                if (Charset.isSupported(candidate)) {
                    return Charset.forName(candidate);
                }
            } catch (IllegalCharsetNameException e) {
                logger.debug("Illegal charset name '{}' derived from locale '{}'", candidate, localeName);
            }
        }
        logger.warn("Unknown codeset '{}' in locale '{}', decoding as UTF-8", codeset, localeName);
        return StandardCharsets.UTF_8;
    }

    private Map<String, String> readTrainingFile(Path file, Charset charset, List<String> categories) throws IOException {
        Map<String, String> texts = new LinkedHashMap<>();
        int index = 0;
        for (String line : readLines(file, charset)) {
            if (index >= categories.size()) {
                break;
            }
            texts.merge(categories.get(index++), line, String::concat);
        }
        if (index < categories.size()) {
            logger.warn("Training file {} has {} lines for {} categories", file, index, categories.size());
        }
        return texts;
    }

    private List<TrainingSet.ValidationSample> readValidationFile(Path file, Charset charset, int categoryCount)
            throws IOException {
        List<TrainingSet.ValidationSample> samples = new ArrayList<>();
        List<List<String>> rows = readRows(file, charset);
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() < 2) {
                continue;
            }
            int index;
            try {
                index = Integer.parseInt(row.get(0).trim());
            } catch (NumberFormatException e) {
                throw new ManifestFormatException("Invalid category index '" + row.get(0) + "' at "
                    + file + ":" + (i + 1), e);
            }
            if (index < 0 || index >= categoryCount) {
                throw new ManifestFormatException("Category index " + index + " out of range [0, "
                    + categoryCount + ") at " + file + ":" + (i + 1));
            }
            samples.add(new TrainingSet.ValidationSample(index, row.get(1)));
        }
        return samples;
    }

    private static Map<String, String> orderByCategory(Map<String, String> texts, List<String> categories) {
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String category : categories) {
            String text = texts.get(category);
            if (text != null) {
                ordered.put(category, text);
            }
        }
        return ordered;
    }

    private static List<List<String>> readRows(Path file, Charset charset) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        for (String line : readLines(file, charset)) {
            rows.add(splitCells(line));
        }
        return rows;
    }

    private static List<String> splitCells(String line) {
        return line.isEmpty() ? List.of() : Arrays.asList(line.split("\t"));
    }

    /**
     * Re-decode a line read as Latin-1 with the manifest's real charset.
     */
    private static String recode(String latin1Line, Charset charset, Path file) throws IOException {
        try {
            return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(latin1Line.getBytes(StandardCharsets.ISO_8859_1)))
                .toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Cannot decode " + file + " as " + charset.name(), e);
        }
    }

    /**
     * Split on LF only; CR is removed from line content, never treated as a line end.
     */
    private static List<String> readLines(Path file, Charset charset) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Failed to open file: `" + file + "`");
        }
        String content = Files.readString(file, charset);
        List<String> lines = new ArrayList<>();
        if (content.isEmpty()) {
            return lines;
        }
        String[] parts = content.split("\n", -1);
        int count = content.endsWith("\n") ? parts.length - 1 : parts.length;
        for (int i = 0; i < count; i++) {
            lines.add(parts[i].replace("\r", ""));
        }
        return lines;
    }
}
