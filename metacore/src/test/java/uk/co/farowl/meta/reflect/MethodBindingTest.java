// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.meta.reflect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.invoke.MethodHandles;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.meta.object.ManualObject;
import uk.co.farowl.meta.support.ReflectionError;
import uk.co.farowl.meta.variant.Variant;
import uk.co.farowl.meta.variant.Variant.Type;

/**
 * Test creation of {@link MethodBinding}s from Java methods and their
 * invocation with {@link Variant} arguments.
 */
@DisplayName("A method binding")
class MethodBindingTest {

    /** Methods to bind that are not in any registered class. */
    static class Arith {
        static int add(int a, int b) { return a + b; }

        @Exposed.Const
        int addConst(int a, int b) { return a + b; }

        long sum(long a, long b) { return a + b; }

        static String describe(@Exposed.Name("x") double x,
                @Exposed.Name("unit") @Exposed.Default("cm") String unit) {
            return x + unit;
        }

        static void fail(String message) {
            throw new IllegalArgumentException(message);
        }

        static Integer boxed(Boolean b) { return b ? 1 : 0; }

        static Variant echo(@Exposed.Default("null") Variant v) { return v; }

        static int badDefaults(@Exposed.Default("1") int a, int b) {
            return a + b;
        }

        static int over(int a) { return a; }

        static int over(int a, int b) { return a + b; }

        static char letter() { return 'x'; }
    }

    @Nested
    @DisplayName("to a static method")
    class StaticMethod {

        MethodBinding add =
                MethodBinding.of(MethodHandles.lookup(), Arith.class, "add");

        @Test
        void has_expected_attributes() {
            assertTrue(add.isStatic());
            assertFalse(add.isConst());
            assertEquals(Type.INT64, add.getReturnType());
            assertEquals(2, add.getArgumentCount());
            assertTrue(add.getDefaults().isEmpty());
            assertEquals(Type.INT64, add.getParameters().get(0).getType());
            assertSame(Arith.class, add.getDeclaringClass());
        }

        @Test
        void invoke_with_array() throws Throwable {
            Variant[] args = {Variant.of(3), Variant.of(4)};
            Invocation r = add.invoke(null, args, 2, List.of());
            assertEquals(InvokeStatus.OK, r.getStatus());
            assertEquals(7L, r.getValue().asInt64());
        }

        @Test
        void receiver_ignored() throws Throwable {
            Invocation r = add.invoke("anything", Variant.of(3), Variant.of(4));
            assertTrue(r.isOK());
            assertEquals(Variant.of(7), r.getValue());
        }

        @Test
        void conversion_is_permissive() throws Throwable {
            // STRING cannot be an int, so it arrives as zero
            Invocation r = add.invoke(null, Variant.of("3"), Variant.of(4.9));
            assertTrue(r.isOK());
            assertEquals(Variant.of(4), r.getValue());
            // null elements are NULL
            r = add.invoke(null, new Variant[] {null, Variant.TRUE}, 2,
                    List.of());
            assertEquals(Variant.of(1), r.getValue());
        }

        @Test
        void wrong_count_rejected() throws Throwable {
            Invocation r = add.invoke(null, Variant.of(3));
            assertEquals(InvokeStatus.ARGUMENT_COUNT_MISMATCH, r.getStatus());
            assertSame(Variant.NULL, r.getValue());
            assertTrue(r.getMessage().contains("takes 2 arguments"));
            r = add.invoke(null, new Variant[3], 3, List.of());
            assertEquals(InvokeStatus.ARGUMENT_COUNT_MISMATCH, r.getStatus());
        }

        @Test
        void defaults_supplied_by_caller() throws Throwable {
            Invocation r = add.invoke(null, new Variant[] {Variant.of(3)}, 1,
                    List.of(Variant.of(10), Variant.of(20)));
            // Defaults align with the last parameter
            assertEquals(Variant.of(23), r.getValue());
            r = add.invoke(null, null, 0,
                    List.of(Variant.of(10), Variant.of(20)));
            assertEquals(Variant.of(30), r.getValue());
        }

        @Test
        void exceptions_propagate() {
            MethodBinding fail = MethodBinding.of(MethodHandles.lookup(),
                    Arith.class, "fail");
            assertEquals(Type.NULL, fail.getReturnType());
            IllegalArgumentException e = assertThrows(
                    IllegalArgumentException.class,
                    () -> fail.invoke(null, Variant.of("boom")));
            assertEquals("boom", e.getMessage());
        }

        @Test
        void boxed_types() throws Throwable {
            MethodBinding boxed = MethodBinding.of(MethodHandles.lookup(),
                    Arith.class, "boxed");
            assertEquals(Type.BOOL, boxed.getParameters().get(0).getType());
            assertEquals(Type.INT64, boxed.getReturnType());
            assertEquals(Variant.of(1),
                    boxed.invoke(null, Variant.TRUE).getValue());
        }

        @Test
        void variant_passes_through() throws Throwable {
            MethodBinding echo = MethodBinding.of(MethodHandles.lookup(),
                    Arith.class, "echo");
            assertEquals(Type.NULL, echo.getReturnType());
            assertEquals(Variant.of("v"),
                    echo.invoke(null, Variant.of("v")).getValue());
            assertSame(Variant.NULL, echo.invoke(null).getValue());
        }
    }

    @Nested
    @DisplayName("to an instance method")
    class InstanceMethod {

        @Test
        void const_method() throws Throwable {
            MethodBinding b = MethodBinding.of(MethodHandles.lookup(),
                    Arith.class, "addConst");
            assertFalse(b.isStatic());
            assertTrue(b.isConst());
            assertEquals(Variant.of(7),
                    b.invoke(new Arith(), Variant.of(3), Variant.of(4))
                            .getValue());
        }

        @Test
        void mutable_method() {
            MethodBinding b = MethodBinding.of(MethodHandles.lookup(),
                    Arith.class, "sum");
            assertFalse(b.isStatic());
            assertFalse(b.isConst());
        }

        @Test
        void receiver_required() throws Throwable {
            MethodBinding b = MethodBinding.of(MethodHandles.lookup(),
                    Arith.class, "sum");
            Invocation r = b.invoke(null, Variant.of(1), Variant.of(2));
            assertEquals(InvokeStatus.INVALID_RECEIVER, r.getStatus());
            r = b.invoke("not Arith", Variant.of(1), Variant.of(2));
            assertEquals(InvokeStatus.INVALID_RECEIVER, r.getStatus());
        }

        @Test
        void released_receiver_rejected() throws Throwable {
            Bar bar = new Bar();
            MethodBinding set = Bar.META.getMethod("Set");
            bar.destroy();
            Invocation r = set.invoke(bar, Variant.of("MUR"));
            assertEquals(InvokeStatus.INVALID_RECEIVER, r.getStatus());
            assertNull(bar.value);
        }
    }

    @Nested
    @DisplayName("defined by annotation")
    class Annotated {

        MethodBinding describe = MethodBinding.of(MethodHandles.lookup(),
                Arith.class, "describe");

        @Test
        void names_and_defaults() {
            List<MethodBinding.Parameter> p = describe.getParameters();
            assertEquals("x", p.get(0).getName());
            assertFalse(p.get(0).hasDefault());
            assertEquals("unit", p.get(1).getName());
            assertEquals(Variant.of("cm"), p.get(1).getDefault());
            assertEquals(List.of(Variant.of("cm")), describe.getDefaults());
        }

        @Test
        void default_applied() throws Throwable {
            assertEquals("2.5cm",
                    describe.invoke(null, Variant.of(2.5)).getValue()
                            .asString());
            assertEquals("2.5in", describe
                    .invoke(null, Variant.of(2.5), Variant.of("in"))
                    .getValue().asString());
        }

        @Test
        void first_argument_still_required() throws Throwable {
            assertEquals(InvokeStatus.ARGUMENT_COUNT_MISMATCH,
                    describe.invoke(null).getStatus());
        }
    }

    @Nested
    @DisplayName("is not made from")
    class Unbindable {

        @Test
        void defaults_not_trailing() {
            assertThrows(ReflectionError.class,
                    () -> MethodBinding.of(MethodHandles.lookup(),
                            Arith.class, "badDefaults"));
        }

        @Test
        void overloaded_method() {
            assertThrows(ReflectionError.class, () -> MethodBinding
                    .of(MethodHandles.lookup(), Arith.class, "over"));
        }

        @Test
        void missing_method() {
            assertThrows(ReflectionError.class, () -> MethodBinding
                    .of(MethodHandles.lookup(), Arith.class, "absent"));
        }

        @Test
        void unsupported_type() {
            assertThrows(ReflectionError.class, () -> MethodBinding
                    .of(MethodHandles.lookup(), Arith.class, "letter"));
        }

        @Test
        void too_many_names() throws NoSuchMethodException {
            assertThrows(ReflectionError.class,
                    () -> MethodBinding.of(MethodHandles.lookup(),
                            Arith.class.getDeclaredMethod("add", int.class,
                                    int.class),
                            List.of("a", "b", "c"), null));
        }
    }

    @Nested
    @DisplayName("in a registered class")
    class Registered {

        @Test
        void static_with_default() throws Throwable {
            MethodBinding setStatic = Bar.META.getMethod("SetStatic");
            assertEquals("value",
                    setStatic.getParameters().get(0).getName());

            // Full argument
            Invocation r = setStatic.invoke(null, Variant.of(3));
            assertEquals(InvokeStatus.OK, r.getStatus());
            assertEquals(Type.NULL, r.getValue().getType());
            assertEquals(3, Bar.staticValue);

            // Default argument
            r = setStatic.invoke(null, new Variant[1], 0,
                    setStatic.getDefaults());
            assertEquals(InvokeStatus.OK, r.getStatus());
            assertEquals(Type.NULL, r.getValue().getType());
            assertEquals(114514, Bar.staticValue);

            MethodBinding getStatic = Bar.META.getMethod("GetStatic");
            r = getStatic.invoke(null, null, 0, List.of());
            assertEquals(InvokeStatus.OK, r.getStatus());
            assertEquals(114514L, r.getValue().asInt64());
        }

        @Test
        void too_few_arguments_has_no_effect() throws Throwable {
            MethodBinding setStatic = Bar.META.getMethod("SetStatic");
            Bar.staticValue = 42;
            // Caller gives no defaults, so one argument is required
            Invocation r = setStatic.invoke(null, null, 0, List.of());
            assertEquals(InvokeStatus.ARGUMENT_COUNT_MISMATCH,
                    r.getStatus());
            assertEquals(42, Bar.staticValue);
        }

        @Test
        void instance_set_and_get() throws Throwable {
            Bar obj = new Bar();
            MethodBinding set = Bar.META.getMethod("Set");
            MethodBinding get = Bar.META.getMethod("Get");
            assertFalse(set.isConst());
            assertTrue(get.isConst());

            Invocation r = set.invoke(obj, Variant.of("MUR"));
            assertEquals(InvokeStatus.OK, r.getStatus());
            assertEquals(Type.NULL, r.getValue().getType());

            r = get.invoke(obj);
            assertEquals(InvokeStatus.OK, r.getStatus());
            assertEquals("MUR", r.getValue().asString());

            // Default
            set.invoke(obj);
            assertEquals("YJSP", obj.value);
            obj.destroy();
        }

        @Test
        void inherited_method_on_subclass() throws Throwable {
            Bar obj = new Bar();
            MethodBinding name = Bar.META.findMethod("GetClassName");
            assertEquals("test.Bar",
                    name.invoke(obj).getValue().asString());
            MethodBinding destroy = Bar.META.findMethod("Destroy");
            assertTrue(destroy.invoke(obj).isOK());
            assertFalse(obj.isAlive());
        }
    }

    /** A class whose instances are not {@code Bar}. */
    static class NotBar extends ManualObject {}

    @Test
    void receiver_of_wrong_registered_class() throws Throwable {
        NotBar other = new NotBar();
        Invocation r = Bar.META.getMethod("Get").invoke(other);
        assertEquals(InvokeStatus.INVALID_RECEIVER, r.getStatus());
        other.destroy();
    }
}
