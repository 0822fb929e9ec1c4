package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.check;
import static org.pragmatica.monostyle.lint.rules.RuleFixtures.format;

class OrderingRulesTest {

    @Test
    void directives_areGroupedByTierAndPrefix() {
        var code = """
                   using MonoTouch.Foundation;
                   using System.Collections.Generic;
                   using MyLib.Extensions;
                   using System;
                   using MonoTouch.UIKit;
                   using System.Linq;
                   using MyLib;

                   class Sample {
                   }
                   """;

        assertThat(format(code, "MONO-ORD-01")).isEqualTo("""
                                                           using System;
                                                           using System.Linq;
                                                           using System.Collections.Generic;

                                                           using MyLib;
                                                           using MyLib.Extensions;

                                                           using MonoTouch.UIKit;
                                                           using MonoTouch.Foundation;

                                                           class Sample {
                                                           }
                                                           """);
    }

    @Test
    void orderedBlock_isAccepted() {
        var code = "using System;\nusing System.IO;\n\nusing MyLib;\n\nclass Sample {\n}\n";

        assertThat(check(code, "MONO-ORD-01")).isEmpty();
    }

    @Test
    void aliasDirectives_formLastGroup() {
        var code = "using Text = System.Text;\nusing System;\n\nclass Sample {\n}\n";

        assertThat(format(code, "MONO-ORD-01")).startsWith("using System;\n\nusing Text = System.Text;\n\nclass");
    }

    @Test
    void blockWithComment_isReportedWithoutFix() {
        var code = "using System;\n// keep this\nusing MyLib;\n\nclass Sample {\n}\n";

        assertThat(check(code, "MONO-ORD-01")).singleElement()
                                              .satisfies(diagnostic -> assertThat(diagnostic.isFixable()).isFalse());
    }

    @Test
    void redundantDirectives_areReported() {
        var code = "using System;\nusing System;\nusing Demo;\nnamespace Demo.Core {\n}\n";

        assertThat(check(code, "MONO-ORD-02")).extracting(Diagnostic::line)
                                              .containsExactly(2, 3);
    }

    @Test
    void redundantDirectives_areDroppedByBlockRewrite() {
        var code = "using System;\nusing System;\nusing Demo;\nnamespace Demo.Core {\n}\n";

        assertThat(format(code, "MONO-ORD-01", "MONO-ORD-02")).isEqualTo("using System;\nnamespace Demo.Core {\n}\n");
    }
}
