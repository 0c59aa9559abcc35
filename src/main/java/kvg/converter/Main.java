package kvg.converter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import kvg.converter.index.Corpus;
import kvg.converter.index.CorpusBuilder;
import kvg.converter.index.DuplicateVariantKeyException;
import kvg.converter.io.ArtifactWriter;
import kvg.converter.scan.DiagramFileFinder;
import kvg.converter.scan.KvgIndex;

public final class Main {

    static final String DEFAULT_KANJI_DIR = "kanji";
    static final String DEFAULT_INDEX = "kvg-index.json";
    static final String DEFAULT_OUT_DIR = "data";

    private Main() {
    }

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path baseDir = null;
        Path kanjiDir = null;
        Path indexFile = null;
        Path outDir = null;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--kanjiDir=")) {
                    kanjiDir = Paths.get(arg.substring("--kanjiDir=".length()));
                    continue;
                }
                if (arg.startsWith("--index=")) {
                    indexFile = Paths.get(arg.substring("--index=".length()));
                    continue;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (baseDir == null) {
                    baseDir = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (baseDir == null) {
                baseDir = Paths.get(".");
            }
            baseDir = baseDir.toAbsolutePath().normalize();
            kanjiDir = resolve(baseDir, kanjiDir, DEFAULT_KANJI_DIR);
            indexFile = resolve(baseDir, indexFile, DEFAULT_INDEX);
            outDir = resolve(baseDir, outDir, DEFAULT_OUT_DIR);

            System.out.println("Loading index " + indexFile + "...");
            final KvgIndex kvgIndex = KvgIndex.load(indexFile);
            System.out.println("Index lists " + kvgIndex.characterCount() + " characters");

            System.out.println("Converting diagrams in " + kanjiDir + "...");
            final CorpusBuilder builder = new CorpusBuilder(new DiagramFileFinder(kanjiDir), kvgIndex);
            final Corpus corpus = builder.build();

            Files.createDirectories(outDir);
            final ArtifactWriter writer = new ArtifactWriter(outDir);
            writer.writeAll(corpus);

            System.out.println("Conversion complete: " + corpus.converted() + " converted, "
                    + corpus.failed() + " failed, " + corpus.filesSeen() + " files seen");
            System.out.println("Data written to: " + outDir);
            System.out.println("  individual/ (" + corpus.converted() + " records)");
            System.out.println("  " + ArtifactWriter.LOOKUP_INDEX + " (" + corpus.lookupIndex().size() + " keys)");
            System.out.println("  " + ArtifactWriter.CHARACTER_INDEX + " (" + corpus.characterIndex().size() + " characters)");
            System.out.println("  " + ArtifactWriter.RADICAL_INDEX + " (" + corpus.radicalIndex().size() + " radicals)");
            System.out.println("  " + ArtifactWriter.RANGE_INDEX + " (" + corpus.rangeIndex().size() + " ranges)");
            if (corpus.failed() > 0) {
                System.err.println("WARN: skipped files: " + String.join(", ", corpus.failedFiles()));
            }
            if (corpus.unindexed() > 0) {
                System.err.println("WARN: diagrams missing from the kvg index: " + corpus.unindexed());
            }
            return 0;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (DuplicateVariantKeyException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (Exception ex) {
            System.err.println("ERROR: conversion failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static Path resolve(Path baseDir, Path given, String fallback) {
        if (given == null) {
            return baseDir.resolve(fallback);
        }
        return given.isAbsolute() ? given : baseDir.resolve(given).normalize();
    }

    private static void printUsage() {
        System.out.println("Usage: kanjivg-converter [baseDir] [options]");
        System.out.println("Options:");
        System.out.println("  --kanjiDir=<path>   Diagram directory (default: <baseDir>/" + DEFAULT_KANJI_DIR + ")");
        System.out.println("  --index=<path>      KanjiVG index file (default: <baseDir>/" + DEFAULT_INDEX + ")");
        System.out.println("  --outDir=<path>     Output directory (default: <baseDir>/" + DEFAULT_OUT_DIR + ")");
        System.out.println("  --help, -h          Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
