package com.e2eq.schemas.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits one form with a section per unit. The first section carries the shared fields;
 * subobjects become repeatable sub-templates.
 */
public class WikitextFormRenderer implements CompositeFormRenderer {

    @Override
    public String render(String compositeName, List<GenerationUnit> units) {
        List<String> lines = new ArrayList<>();
        lines.add("<noinclude>");
        lines.add("<!-- Generated form for " + compositeName + " -->");
        lines.add("</noinclude><includeonly>");

        for (GenerationUnit unit : units) {
            lines.add("{{{for template|" + unit.category() + "}}}");
            lines.add("== " + unit.category() + " ==");
            lines.addAll(table(unit.properties()));
            lines.add("{{{end template}}}");

            for (SubobjectSpec s : unit.subobjects()) {
                StringBuilder head = new StringBuilder("{{{for template|")
                        .append(unit.category()).append('/').append(s.subobject())
                        .append("|multiple|label=").append(s.label());
                if (s.mandatory()) {
                    head.append("|minimum instances=1");
                }
                lines.add(head.append("}}}").toString());
                lines.addAll(table(s.fields()));
                lines.add("{{{end template}}}");
            }
        }

        lines.add("{{{standard input|save}}} {{{standard input|cancel}}}");
        lines.add("</includeonly>");
        return String.join("\n", lines);
    }

    private static List<String> table(List<FieldSpec> fields) {
        List<String> lines = new ArrayList<>();
        if (fields.isEmpty()) {
            return lines;
        }
        lines.add("{| class=\"formtable\"");
        for (FieldSpec f : fields) {
            lines.add("! " + f.label() + (f.mandatory() ? " *" : "") + ":");
            lines.add("| {{{field|" + f.parameter() + "|" + f.input() + "}}}");
            lines.add("|-");
        }
        lines.add("|}");
        return lines;
    }
}
