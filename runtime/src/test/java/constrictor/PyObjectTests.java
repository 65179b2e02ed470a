package constrictor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PyObjectTests {

  private final FakeCallTable table = new FakeCallTable();
  private final Interpreter interpreter = new Interpreter(table);

  @Test
  void callsWithNamedArguments() {
    final PyObject string = interpreter.importModule("string");
    final PyObject capitalized = string.callMethod(
        "capwords",
        Collections.singletonList(interpreter.of("foo,bar,baz")),
        Collections.singletonMap("sep", interpreter.of(","))
    );
    Assertions.assertEquals("Foo,Bar,Baz", capitalized.toString());
    Assertions.assertEquals("Foo Bar", string.callMethod("capwords", interpreter.of("foo bar")).toString());
  }

  @Test
  void callsMethods() {
    final PyObject split = interpreter.of("foo,bar,baz").callMethod("split", interpreter.of(","), interpreter.of(1));
    Assertions.assertEquals("['foo', 'bar,baz']", split.toString());
    Assertions.assertEquals(
        Arrays.asList("foo", "bar,baz"),
        split.toList().stream().map(PyObject::toString).collect(Collectors.toList())
    );
  }

  @Test
  void appliesAsCallOrSubscript() {
    final PyObject list = interpreter.list("foo", "bar", "baz");
    Assertions.assertEquals("bar", list.apply(interpreter.of(1)).toString());

    final PyObject len = interpreter.builtin("len");
    Assertions.assertTrue(len.callable());
    Assertions.assertEquals(3, len.apply(list).toLong());

    final PyObject dict = interpreter.dict(Collections.singletonMap("key", "value"));
    Assertions.assertEquals("value", dict.apply(interpreter.of("key")).toString());
  }

  @Test
  void readsAndWritesItems() {
    final PyObject dict = interpreter.dict(Collections.singletonMap("a", 1));
    dict.setItem(interpreter.of("b"), interpreter.of(2));
    Assertions.assertEquals(2, dict.getItem(interpreter.of("b")).toLong());
    Assertions.assertEquals("{'a': 1, 'b': 2}", dict.toString());

    final PythonException error = Assertions.assertThrows(
        PythonException.class,
        () -> dict.getItem(interpreter.of("missing"))
    );
    Assertions.assertEquals("KeyError", error.getTypeName());
    Assertions.assertEquals("[KeyError] 'missing'", error.getMessage());

    final PyObject list = interpreter.list(1, 2, 3);
    list.setItem(interpreter.of(-1), interpreter.of("last"));
    Assertions.assertEquals("last", list.getItem(2).toString());
    Assertions.assertThrows(PythonException.class, () -> list.getItem(3));
  }

  @Test
  void readsAndWritesAttributes() {
    final PyObject namespace = interpreter.builtin("namespace").call(
        Collections.emptyList(),
        Collections.singletonMap("foo", interpreter.of(1))
    );
    Assertions.assertTrue(namespace.hasAttribute("foo"));
    Assertions.assertFalse(namespace.hasAttribute("bar"));

    namespace.setAttribute("bar", interpreter.of("baz"));
    Assertions.assertEquals(1, namespace.getAttribute("foo").toLong());
    Assertions.assertEquals("baz", namespace.getAttribute("bar").toString());
    Assertions.assertEquals("SimpleNamespace", namespace.getAttribute("__class__").getAttribute("__name__").toString());

    final PythonException error = Assertions.assertThrows(
        PythonException.class,
        () -> interpreter.of(1).getAttribute("nope")
    );
    Assertions.assertEquals("[AttributeError] 'int' object has no attribute 'nope'", error.getMessage());
  }

  @Test
  void propagatesErrorsFromAttributeChecks() {
    final PyObject failing = interpreter.wrap(table.newObjectWithProperty(
        "x",
        (args, kwargs) -> table.raise("RuntimeError", "boom")
    ));
    final PythonException error = Assertions.assertThrows(
        PythonException.class,
        () -> failing.hasAttribute("x")
    );
    Assertions.assertEquals("[RuntimeError] boom", error.getMessage());
    Assertions.assertFalse(table.errOccurred());

    final PyObject missing = interpreter.wrap(table.newObjectWithProperty(
        "x",
        (args, kwargs) -> table.raise("AttributeError", "not yet")
    ));
    Assertions.assertFalse(missing.hasAttribute("x"));
    Assertions.assertFalse(table.errOccurred());
  }

  @Test
  void comparesWithPythonSemantics() {
    final PyObject sum = interpreter.of(100).add(interpreter.of(200));
    Assertions.assertEquals(interpreter.of(300), sum);
    Assertions.assertEquals(interpreter.of(300.0), sum);
    Assertions.assertTrue(sum.notEqual(interpreter.of(301)));
    Assertions.assertTrue(sum.lessThan(interpreter.of(301)));
    Assertions.assertTrue(sum.lessOrEqual(interpreter.of(300)));
    Assertions.assertTrue(sum.greaterThan(interpreter.of(299)));
    Assertions.assertTrue(sum.greaterOrEqual(interpreter.of(300)));
    Assertions.assertEquals(interpreter.list(1, "a"), interpreter.list(1, "a"));

    final PythonException error = Assertions.assertThrows(
        PythonException.class,
        () -> sum.lessThan(interpreter.of("300"))
    );
    Assertions.assertEquals("TypeError", error.getTypeName());
  }

  @Test
  void isNeverEqualToPlainJavaValues() {
    final PyObject foo = interpreter.of("foo");
    final int calls = table.calls();
    final int comparisons = table.richComparisons();

    Assertions.assertNotEquals(foo, "foo");
    Assertions.assertFalse(foo.equals(null));

    Assertions.assertEquals(calls, table.calls());
    Assertions.assertEquals(comparisons, table.richComparisons());
  }

  @Test
  void hashesLikePython() {
    Assertions.assertEquals(42, interpreter.of(42).hash());
    Assertions.assertEquals(interpreter.of(42).hashCode(), interpreter.of(42.0).hashCode());

    // -1 is a legitimate hash as long as no error is set.
    Assertions.assertEquals(-1, interpreter.wrap(table.newHashable(-1)).hash());

    final PythonException error = Assertions.assertThrows(
        PythonException.class,
        () -> interpreter.list(1, 2).hash()
    );
    Assertions.assertEquals("[TypeError] unhashable type: 'list'", error.getMessage());
  }

  @Test
  void convertsToStrings() {
    Assertions.assertEquals("1.0", interpreter.of(1.0).toString());
    Assertions.assertEquals("['foo', 'bar', 'baz']", interpreter.list("foo", "bar", "baz").toString());
    Assertions.assertEquals("foo", interpreter.of("foo").toString());
    Assertions.assertEquals("'foo'", interpreter.of("foo").repr());
    Assertions.assertEquals("None", interpreter.none().toString());
  }

  @Test
  void testsTruth() {
    Assertions.assertFalse(interpreter.of(0).isTrue());
    Assertions.assertTrue(interpreter.of(-1).isTrue());
    Assertions.assertFalse(interpreter.list().isTrue());
    Assertions.assertTrue(interpreter.of("x").toBoolean());
    Assertions.assertFalse(interpreter.none().isTrue());
    Assertions.assertTrue(interpreter.none().isNone());
    Assertions.assertFalse(interpreter.of(0).isNone());
  }

  @Test
  void appliesArithmetic() {
    final PyObject seven = interpreter.of(7);
    final PyObject two = interpreter.of(2);
    Assertions.assertEquals(81, interpreter.of(3).power(interpreter.of(4)).toLong());
    Assertions.assertEquals(1, interpreter.of(3).power(interpreter.of(4), interpreter.of(5)).toLong());
    Assertions.assertEquals(3, seven.floorDivide(two).toLong());
    Assertions.assertEquals(3.5, seven.trueDivide(two).toDouble());
    Assertions.assertEquals(1, seven.remainder(two).toLong());
    Assertions.assertEquals(-4, seven.negative().floorDivide(two).toLong());
    Assertions.assertEquals(1, seven.negative().remainder(two).toLong());
    Assertions.assertEquals(28, seven.leftShift(two).toLong());
    Assertions.assertEquals(1, seven.rightShift(two).toLong());
    Assertions.assertEquals(2, seven.and(two).toLong());
    Assertions.assertEquals(5, seven.xor(two).toLong());
    Assertions.assertEquals(7, seven.or(two).toLong());
    Assertions.assertEquals(-8, seven.invert().toLong());
    Assertions.assertEquals(7, seven.positive().toLong());
    Assertions.assertEquals("foofoo", interpreter.of("foo").multiply(two).toString());

    final PythonException error = Assertions.assertThrows(
        PythonException.class,
        () -> seven.floorDivide(interpreter.of(0))
    );
    Assertions.assertEquals("ZeroDivisionError", error.getTypeName());
    Assertions.assertThrows(PythonException.class, () -> seven.matrixMultiply(two));
    Assertions.assertThrows(PythonException.class, () -> interpreter.of("x").negative());
  }

  @Test
  void rebindsOnAugmentedAssignment() {
    final PyObject number = interpreter.of(1);
    final long before = number.handle();
    Assertions.assertSame(number, number.addInPlace(interpreter.of(2)));
    Assertions.assertEquals(3, number.toLong());
    Assertions.assertNotEquals(before, number.handle());
    Assertions.assertFalse(table.alive(before));

    number.multiplyInPlace(interpreter.of(4)).subtractInPlace(interpreter.of(2));
    Assertions.assertEquals(10, number.toLong());
    number.powerInPlace(interpreter.of(2), interpreter.of(7));
    Assertions.assertEquals(2, number.toLong());
  }

  @Test
  void mutatesInPlaceWhenPythonDoes() {
    final PyObject list = interpreter.list(1, 2);
    final long before = list.handle();
    list.addInPlace(interpreter.list(3));
    Assertions.assertEquals(before, list.handle());
    Assertions.assertEquals("[1, 2, 3]", list.toString());
    Assertions.assertEquals(1, table.refCount(before));
  }

  @Test
  void convertsToJavaPrimitives() {
    Assertions.assertEquals(-1, interpreter.of(-1).toLong());
    Assertions.assertEquals(2.0, interpreter.of(2).toDouble());
    Assertions.assertEquals((byte) 1, interpreter.of(257).toByte());
    Assertions.assertEquals(1.5f, interpreter.of(1.5).toFloat());
    Assertions.assertEquals(-1.0, interpreter.of(-1.0).toDouble());
    Assertions.assertThrows(PythonException.class, () -> interpreter.of("1").toLong());
    Assertions.assertThrows(PythonException.class, () -> interpreter.of("1").toDouble());
  }

  @Test
  void collectsContainers() {
    final List<PyObject> elements = interpreter.tuple(1, "two", 3.0).toList();
    Assertions.assertEquals(3, elements.size());
    Assertions.assertEquals("two", elements.get(1).toString());

    Assertions.assertEquals(2, interpreter.list(1, 1, 2).toSet().size());
    Assertions.assertEquals(
        Collections.singletonMap(interpreter.of("a"), interpreter.of(1)),
        interpreter.dict(Collections.singletonMap("a", 1)).toMap()
    );

    long sum = 0;
    for (final PyObject element : interpreter.list(1, 2, 3)) {
      sum += element.toLong();
    }
    Assertions.assertEquals(6, sum);
  }

  @Test
  void freesEverythingOnceAllProxiesAreClosed() {
    final int objects = table.liveObjects();
    final long references = interpreter.references().liveReferences();
    try (PyObject list = interpreter.list(1L, "two", 3.0);
        PyObject tuple = interpreter.tuple(list, 4L);
        PyObject inner = tuple.getItem(0);
        PyObject len = interpreter.builtin("len");
        PyObject size = len.call(inner);
        PyObject three = interpreter.of(3);
        PyObject sum = size.add(three)) {
      Assertions.assertEquals(6, sum.toLong());
      Assertions.assertEquals("([1, 'two', 3.0], 4)", tuple.toString());
    }
    Assertions.assertEquals(objects, table.liveObjects());
    Assertions.assertEquals(references, interpreter.references().liveReferences());
  }

  @Test
  void throwsWhenUseAfterFree() {
    final PyObject obj = interpreter.of(1);
    Assertions.assertThrows(AssertionError.class, () -> {
      obj.close();
      obj.toLong();
    });
  }
}
