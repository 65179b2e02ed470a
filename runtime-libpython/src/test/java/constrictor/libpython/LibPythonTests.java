package constrictor.libpython;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LibPythonTests {

  @Test
  void fixesUpInterpreterState() {
    Assertions.assertEquals(
        "import sys\n"
            + "sys.argv = ['']\n"
            + "sys.executable = '/usr/bin/python3'\n"
            + "sys.path.insert(0, '')\n",
        LibPython.fixupScript("/usr/bin/python3", Collections.emptyList())
    );
  }

  @Test
  void addsSearchPathsInOrder() {
    final String script = LibPython.fixupScript("python", Arrays.asList("first", "second"));
    Assertions.assertTrue(script.endsWith(
        "sys.path.insert(1, 'first')\nsys.path.insert(2, 'second')\n"));
  }

  @Test
  void quotesStringLiterals() {
    Assertions.assertEquals("'C:\\\\Python\\\\python.exe'", LibPython.literal("C:\\Python\\python.exe"));
    Assertions.assertEquals("'it\\'s'", LibPython.literal("it's"));
    Assertions.assertEquals("'a\\nb'", LibPython.literal("a\nb"));
  }
}
