package dfakit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestFileReaderTest {

  @TempDir
  Path directory;

  private Path write(String content) throws IOException {
    final Path file = directory.resolve("cases.txt");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  @Test
  void skipsCommentsAndBlankLines() throws IOException {
    final Path file = write("// header\n\nm.afd\n\n// input next\nab\ntrue q1 2\n");

    try (var reader = new TestFileReader(file)) {
      final TestCase testCase = reader.readTestCase();
      assertEquals(directory.toAbsolutePath().resolve("m.afd"), testCase.automatonPath);
      assertEquals("ab", testCase.input);
      assertEquals("true q1 2", testCase.output);
      assertEquals(3, testCase.lineNumber);
      assertNull(reader.readTestCase());
    }
  }

  @Test
  void emptyInputMarker() throws IOException {
    final Path file = write("m.afd\n<empty>\nfalse q0 0\n");

    try (var reader = new TestFileReader(file)) {
      assertEquals("", reader.readTestCase().input);
    }
  }

  @Test
  void escapes() {
    assertEquals("a\nb", TestFileReader.processLineEscapes("a\\nb"));
    assertEquals("xAy", TestFileReader.processLineEscapes("x\\u0041y"));
  }

  @Test
  void truncatedCase() throws IOException {
    final Path file = write("m.afd\nab\n");

    try (var reader = new TestFileReader(file)) {
      assertThrows(IOException.class, reader::readTestCase);
    }
  }
}
