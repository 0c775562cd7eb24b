package com.arbor.ast;

import org.junit.jupiter.api.Test;

import static com.arbor.ast.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class AnnotationTest {

    record ResolvedType(String name) {
    }

    @Test
    void testNewNodeHasNoAnnotations() {
        Identifier x = id("x");
        assertFalse(x.hasAnnotations());
        assertFalse(x.containsAnnotation("k"));
        assertNull(x.getAnnotation("k"));
        assertNull(x.tags().get(ResolvedType.class));
    }

    @Test
    void testTypedSlot() {
        Identifier x = id("x");
        x.tags().set(ResolvedType.class, new ResolvedType("int"));
        x.tags().set(String.class, "note");

        assertEquals(new ResolvedType("int"), x.tags().get(ResolvedType.class));
        assertEquals("note", x.tags().get(String.class));
        assertNull(x.tags().get(Integer.class));
        assertTrue(x.containsAnnotation(ResolvedType.class));
    }

    @Test
    void testTypedSlotRejectsSecondValueOfSameType() {
        Identifier x = id("x");
        x.tags().set(ResolvedType.class, new ResolvedType("int"));

        DuplicateAnnotationException e = assertThrows(DuplicateAnnotationException.class,
                () -> x.tags().set(ResolvedType.class, new ResolvedType("long")));
        assertEquals(ResolvedType.class, e.getKey());
        assertEquals(new ResolvedType("int"), x.tags().get(ResolvedType.class));
    }

    @Test
    void testAnnotateTwiceFails() {
        Identifier x = id("x");
        x.annotate("checked", true);

        DuplicateAnnotationException e = assertThrows(DuplicateAnnotationException.class,
                () -> x.annotate("checked", false));
        assertEquals("checked", e.getKey());
        assertEquals(true, x.getAnnotation("checked"));
    }

    @Test
    void testAnnotateWithKeyOnly() {
        Identifier x = id("x");
        x.annotate("marker");
        assertTrue(x.containsAnnotation("marker"));
        assertEquals("marker", x.getAnnotation("marker"));
        assertTrue(x.hasAnnotations());
    }

    @Test
    void testSetAnnotationOverwrites() {
        Identifier x = id("x");
        x.setAnnotation("k", 1);
        x.setAnnotation("k", 2);
        assertEquals(2, x.getAnnotation("k"));
    }

    @Test
    void testRemoveAnnotation() {
        Identifier x = id("x");
        x.removeAnnotation("absent");

        x.annotate("k", "v");
        x.removeAnnotation("k");
        assertFalse(x.containsAnnotation("k"));
        assertFalse(x.hasAnnotations());

        // Removed keys can be added again
        x.annotate("k", "w");
        assertEquals("w", x.getAnnotation("k"));
    }

    @Test
    void testNullKeyIsRejected() {
        Identifier x = id("x");
        assertThrows(IllegalArgumentException.class, () -> x.annotate(null, "v"));
        assertThrows(IllegalArgumentException.class, () -> x.setAnnotation(null, "v"));
    }

    @Test
    void testClearTypeSystemBindingsCoversSubtree() {
        Identifier a = id("a");
        Literal one = lit(1);
        BinaryExpression sum = add(a, one);
        ExpressionStatement statement = stmt(sum);

        statement.annotate("reachable");
        sum.setEntity(entity("plus"));
        a.tags().set(String.class, "int");
        one.annotate("constant", 1L);

        statement.clearTypeSystemBindings();

        assertFalse(statement.hasAnnotations());
        assertNull(sum.getEntity());
        assertFalse(a.hasAnnotations());
        assertFalse(one.hasAnnotations());
    }
}
