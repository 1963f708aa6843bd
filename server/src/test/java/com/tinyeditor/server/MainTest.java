package com.tinyeditor.server;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testTeeWritesToConsoleAndFile() {
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        ByteArrayOutputStream file = new ByteArrayOutputStream();

        PrintStream out = new PrintStream(new Main.TeeOutputStream(console, file), true, StandardCharsets.UTF_8);
        out.println("Kernel active.");
        out.write('!');
        out.flush();

        String expected = "Kernel active." + System.lineSeparator() + "!";
        assertEquals(expected, console.toString(StandardCharsets.UTF_8));
        assertEquals(expected, file.toString(StandardCharsets.UTF_8));
    }
}
