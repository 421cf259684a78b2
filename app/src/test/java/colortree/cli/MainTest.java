package colortree.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {

  @Test
  void treeCommandWritesReport(@TempDir Path temp) throws IOException {
    Path report = temp.resolve("report.json");

    int exit =
        Main.run(
            new String[] {
              "tree", "--nodes", "3", "--edges", "0-1,1-2,0-2", "--output", report.toString(),
              "--export-dir", temp.resolve("export").toString()
            });

    assertEquals(Main.EXIT_OK, exit);
    JsonObject json = JsonParser.parseString(Files.readString(report)).getAsJsonObject();
    JsonObject classification = json.getAsJsonObject("classification");
    assertEquals(27, classification.get("leaves").getAsInt());
    assertEquals(6, classification.get("valid").getAsInt());
    assertEquals(6, json.getAsJsonArray("valid_colorings").size());
    assertTrue(Files.exists(temp.resolve("export").resolve("tree.json")));
  }

  @Test
  void programCommandSavesSource(@TempDir Path temp) throws IOException {
    Path target = temp.resolve("coloring.c");

    int exit =
        Main.run(
            new String[] {
              "program", "--nodes", "2", "--edges", "0-1", "--colors", "2", "--save",
              target.toString()
            });

    assertEquals(Main.EXIT_OK, exit);
    assertTrue(Files.readString(target).contains("klee_assume(color_0 != color_1);"));
  }

  @Test
  void mapsFailuresToExitCodes() {
    assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"frobnicate"}));
    assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"tree", "--nodes"}));
    assertEquals(
        Main.EXIT_FAILURE, Main.run(new String[] {"tree", "--nodes", "2", "--edges", "0-5"}));
    assertEquals(
        Main.EXIT_FAILURE,
        Main.run(new String[] {"tree", "--nodes", "12", "--colors", "4", "--max-leaves", "1000"}));
    assertEquals(Main.EXIT_OK, Main.run(new String[] {"help"}));
  }
}
