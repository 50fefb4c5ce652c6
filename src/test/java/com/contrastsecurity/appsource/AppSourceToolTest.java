package com.contrastsecurity.appsource;

import com.contrastsecurity.appsource.model.Catalog;
import com.contrastsecurity.appsource.util.CatalogJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command line tests that need no network access
 */
public class AppSourceToolTest {

    private static final String TEMP_OUTPUT_DIR = "target/test-output/cli";

    private ByteArrayOutputStream outputStream;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeAll
    static void setupTestEnvironment() throws IOException {
        Files.createDirectories(Paths.get(TEMP_OUTPUT_DIR));
    }

    @BeforeEach
    void setupStreams() {
        outputStream = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outputStream));
        System.setErr(new PrintStream(outputStream));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String output() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testHelp() {
        AppSourceTool.main(new String[]{"help"});
        assertTrue(output().contains("Usage: appsource <subcommand>"));
    }

    @Test
    public void testUnknownSubcommand() {
        AppSourceTool.main(new String[]{"publish"});
        assertTrue(output().contains("Unknown subcommand: publish"));
    }

    @Test
    public void testCreateThenValidate() throws IOException {
        Path path = Paths.get(TEMP_OUTPUT_DIR, "created.json");
        Files.deleteIfExists(path);

        AppSourceTool.main(new String[]{"create", path.toString(), "--name=My Apps", "--identifier=com.example.source"});
        assertTrue(Files.exists(path), "Catalog file should be created");
        Catalog catalog = CatalogJson.load(path);
        assertEquals("My Apps", catalog.getName());
        assertEquals("com.example.source", catalog.getIdentifier());

        AppSourceTool.main(new String[]{"validate", path.toString()});
        assertTrue(output().contains("Catalog is valid: 0 app(s)"));
    }

    @Test
    public void testCreateRequiresNameAndIdentifier() {
        Path path = Paths.get(TEMP_OUTPUT_DIR, "incomplete.json");
        AppSourceTool.main(new String[]{"create", path.toString(), "--name=My Apps"});
        assertTrue(output().contains("Usage: appsource create"));
        assertFalse(Files.exists(path));
    }

    @Test
    public void testValidateReportsProblems() throws IOException {
        Path path = Paths.get(TEMP_OUTPUT_DIR, "broken.json");
        Files.writeString(path, TestFixtures.readResource("catalogs/mirror.json"), StandardCharsets.UTF_8);

        AppSourceTool.main(new String[]{"validate", path.toString()});

        String output = output();
        assertTrue(output.contains("App org.example.broken is invalid"));
        assertTrue(output.contains("News article invalid-article is missing"));
        assertTrue(output.contains("2 problem(s) found"));
    }
}
