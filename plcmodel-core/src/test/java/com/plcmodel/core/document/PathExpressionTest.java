package com.plcmodel.core.document;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PathExpression}.
 */
class PathExpressionTest {

    @Test
    void of_descendantPath_matchesOnLocalName() {
        assertThat(PathExpression.of(".//dataType").xpath())
            .isEqualTo(".//*[local-name()='dataType']");
    }

    @Test
    void of_childSteps_translatesEachStep() {
        assertThat(PathExpression.of("./baseType/enum").xpath())
            .isEqualTo("./*[local-name()='baseType']/*[local-name()='enum']");
    }

    @Test
    void of_predicateWithSlashes_isCopiedVerbatim() {
        PathExpression expression = PathExpression.of(".//addData/data[@name='http://example.com/app']");

        assertThat(expression.xpath())
            .isEqualTo(".//*[local-name()='addData']/*[local-name()='data'][@name='http://example.com/app']");
        assertThat(expression.source()).isEqualTo(".//addData/data[@name='http://example.com/app']");
    }

    @Test
    void of_selfAndWildcard_areKept() {
        assertThat(PathExpression.of(".").xpath()).isEqualTo(".");
        assertThat(PathExpression.of("./*").xpath()).isEqualTo("./*");
    }

    @Test
    void of_blankPath_throws() {
        assertThatThrownBy(() -> PathExpression.of("  "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void of_unclosedPredicate_throws() {
        assertThatThrownBy(() -> PathExpression.of(".//data[@name='x'"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unclosed predicate");
    }
}
