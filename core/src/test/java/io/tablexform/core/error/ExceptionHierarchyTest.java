package io.tablexform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Modifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: tiers, phases and step annotation. */
@DisplayName("ExceptionHierarchyTest")
class ExceptionHierarchyTest {

    @Test
    @DisplayName("base and apply tiers are abstract runtime exceptions")
    void abstractTiers() {
        assertThat(Modifier.isAbstract(TransformException.class.getModifiers())).isTrue();
        assertThat(Modifier.isAbstract(TransformApplyException.class.getModifiers())).isTrue();
        assertThat(RuntimeException.class).isAssignableFrom(TransformException.class);
    }

    @Test
    @DisplayName("parse failures carry source and element")
    void parseException() {
        TransformParseException e = new TransformParseException("bad key", "seq.yaml", 3);

        assertThat(e.phase()).isEqualTo(TransformException.Phase.PARSE);
        assertThat(e.source()).isEqualTo("seq.yaml");
        assertThat(e.element()).isEqualTo(3);
        assertThat(e.detail()).isEqualTo("bad key");
    }

    @Test
    @DisplayName("apply failures start without a step")
    void applyWithoutStep() {
        UnknownColumnException e = new UnknownColumnException("Column 'x' not found", "x", "select_columns");

        assertThat(e.phase()).isEqualTo(TransformException.Phase.APPLY);
        assertThat(e.step()).isNull();
        assertThat(e.getMessage()).isEqualTo("Column 'x' not found");
        assertThat(e.column()).isEqualTo("x");
        assertThat(e.operator()).isEqualTo("select_columns");
    }

    @Test
    @DisplayName("atStep keeps the concrete type, context, cause and stack trace")
    void atStepPreservesEverything() {
        IllegalStateException cause = new IllegalStateException("root");
        ConversionException original = new ConversionException("Cannot convert 'x'", cause, "amount", "int", 4);

        ConversionException annotated = original.atStep(2);

        assertThat(annotated).isNotSameAs(original);
        assertThat(annotated.step()).isEqualTo(2);
        assertThat(annotated.row()).isEqualTo(4);
        assertThat(annotated.column()).isEqualTo("amount");
        assertThat(annotated.operator()).isEqualTo("int");
        assertThat(annotated.getCause()).isSameAs(cause);
        assertThat(annotated.getStackTrace()).isEqualTo(original.getStackTrace());
        assertThat(annotated.getMessage()).isEqualTo("step 2: Cannot convert 'x'");
        assertThat(annotated.detail()).isEqualTo("Cannot convert 'x'");
    }

    @Test
    @DisplayName("annotating twice replaces the step instead of stacking prefixes")
    void reannotate() {
        SampleSizeException e = new SampleSizeException("too many", null, "sample_rows");

        SampleSizeException twice = e.atStep(1).atStep(5);

        assertThat(twice.getMessage()).isEqualTo("step 5: too many");
    }

    @Test
    @DisplayName("every apply failure type survives annotation")
    void allSubtypes() {
        TransformApplyException[] failures = {
            new UnknownColumnException("m", "c", "o"),
            new UnsupportedOperatorException("m", "c", "o"),
            new DuplicateColumnException("m", "c", "o"),
            new SampleSizeException("m", "c", "o"),
            new UnreachableVariantException("m", "c", "o"),
            new ConversionException("m", "c", "o", 0)
        };
        for (TransformApplyException failure : failures) {
            assertThat(failure.atStep(0)).isExactlyInstanceOf(failure.getClass());
        }
    }
}
