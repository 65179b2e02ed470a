package constrictor;

import constrictor.libpython.LibPython;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

@EnabledIfEnvironmentVariable(named = "CONSTRICTOR_PYTHON", matches = ".+")
class IntegrationTests {

  private static Interpreter python;

  @BeforeAll
  static void start() {
    python = LibPython.start();
  }

  @Test
  void callsFunctions() {
    final PyObject capwords = python.importModule("string").getAttribute("capwords");
    Assertions.assertEquals("Hello World", capwords.call(python.of("hello world")).toString());
    Assertions.assertEquals("Hello_World", capwords.call(python.of("hello_world"), python.of('_')).toString());
    Assertions.assertEquals("Hello_World", capwords.call(
        Collections.singletonList(python.of("hello_world")),
        Collections.singletonMap("sep", python.of('_'))
    ).toString());

    final List<String> split = python.of("foo,bar,baz")
        .callMethod(
            "split",
            Collections.singletonList(python.of(',')),
            Collections.singletonMap("maxsplit", python.of(1))
        )
        .toList()
        .stream()
        .map(PyObject::toString)
        .collect(Collectors.toList());
    Assertions.assertEquals(Arrays.asList("foo", "bar,baz"), split);
  }

  @Test
  void subscripts() {
    final PyObject dict = python.dict(Collections.singletonMap("foo", "bar"));
    Assertions.assertEquals("bar", dict.apply(python.of("foo")).toString());
    dict.setItem(python.of("foo"), python.of("baz"));
    Assertions.assertEquals("baz", dict.apply(python.of("foo")).toString());

    final PyObject list = python.list(0, 1, 2, 3, 4);
    Assertions.assertEquals("[4, 3, 2, 1, 0]", list.getItem(python.slice(IntRange.to(4, 0).by(-1))).toString());
  }

  @Test
  void readsAndWritesAttributes() {
    final PyObject complex = python.builtin("complex").call(python.of(1), python.of(2));
    Assertions.assertEquals(1.0, complex.getAttribute("real").toDouble());
    Assertions.assertEquals(2.0, complex.getAttribute("imag").toDouble());

    final PyObject namespace = python.importModule("types").callMethod("SimpleNamespace");
    namespace.setAttribute("foo", python.of("bar"));
    Assertions.assertEquals("bar", namespace.getAttribute("foo").toString());
    Assertions.assertTrue(namespace.hasAttribute("foo"));
    Assertions.assertFalse(namespace.hasAttribute("missing"));

    final PyObject failingType = python.builtin("type").call(
        python.of("Failing"),
        python.tuple(python.builtin("object")),
        python.dict(Collections.singletonMap("x", python.builtin("property").call(python.builtin("len"))))
    );
    final PyObject failing = failingType.call();
    final PythonException error = Assertions.assertThrows(
        PythonException.class,
        () -> failing.hasAttribute("x")
    );
    Assertions.assertEquals("TypeError", error.getTypeName());
  }

  @Test
  void comparesAndHashes() {
    Assertions.assertEquals(python.of("foo"), python.of("foo"));
    Assertions.assertNotEquals(python.of("foo"), python.of("bar"));
    Assertions.assertNotEquals(python.of("foo"), "foo");
    Assertions.assertEquals(python.of(300), python.of(100).add(python.of(200)));

    Assertions.assertEquals((int) 1656245132797518850L, python.importModule("math").getAttribute("e").hashCode());
  }

  @Test
  void convertsToStrings() {
    Assertions.assertEquals("str", python.of("str").toString());
    Assertions.assertEquals("1.0", python.of(1.0).toString());
    Assertions.assertEquals("['foo', 'bar', 'baz']", python.list("foo", "bar", "baz").toString());
  }

  @Test
  void appliesOperators() {
    Assertions.assertEquals(81, python.of(3).power(python.of(4)).toLong());
    Assertions.assertEquals(-4, python.of(-7).floorDivide(python.of(2)).toLong());
    Assertions.assertEquals(3.5, python.of(7).trueDivide(python.of(2)).toDouble());

    final PyObject list = python.list(1, 2);
    final PyObject id = python.builtin("id");
    final long before = id.call(list).toLong();
    list.addInPlace(python.list(3));
    Assertions.assertEquals(before, id.call(list).toLong());
    Assertions.assertEquals("[1, 2, 3]", list.toString());
  }

  @Test
  void iterates() {
    final PyObject range = python.builtin("range").call(python.of(3));
    long sum = 0;
    for (final PyObject element : range) {
      sum += element.toLong();
    }
    Assertions.assertEquals(3, sum);
    Assertions.assertEquals(
        3L,
        (long) range.iterator().toRxJavaFlowable().count().blockingGet()
    );
  }

  @Test
  void translatesErrors() {
    final PythonException error = Assertions.assertThrows(
        PythonException.class,
        () -> python.importModule("json").callMethod("loads", python.of("{"))
    );
    Assertions.assertEquals("JSONDecodeError", error.getTypeName());
    Assertions.assertTrue(error.getMessage().startsWith("[JSONDecodeError] "));
    Assertions.assertTrue(error.getStackTrace()[0].getClassName().startsWith("<python"));
    Assertions.assertTrue(error.getStackTrace()[0].getFileName().endsWith(".py"));
    Assertions.assertFalse(python.table().errOccurred());
  }

  @Test
  void balancesReferenceCounts() {
    final PyObject getrefcount = python.importModule("sys").getAttribute("getrefcount");
    final PyObject obj = python.builtin("object").call();
    final long baseline = getrefcount.call(obj).toLong();

    final PyObject[] proxies = new PyObject[10];
    for (int i = 0; i < proxies.length; i++) {
      proxies[i] = python.toPython(obj);
    }
    Assertions.assertEquals(baseline + proxies.length, getrefcount.call(obj).toLong());
    for (final PyObject proxy : proxies) {
      proxy.close();
    }
    Assertions.assertEquals(baseline, getrefcount.call(obj).toLong());
  }

  @Test
  void marshalsBson() {
    final BsonDocument document = BsonDocument.parse("{\"name\": \"constrictor\", \"tags\": [1, 2.5, true, null]}");
    final PyObject dumps = python.importModule("json").getAttribute("dumps");
    Assertions.assertEquals(
        "{\"name\": \"constrictor\", \"tags\": [1, 2.5, true, null]}",
        dumps.call(Marshaler.toPython(python, document)).toString()
    );
    Assertions.assertEquals(document, Marshaler.toBson(Marshaler.toPython(python, document)));
  }
}
