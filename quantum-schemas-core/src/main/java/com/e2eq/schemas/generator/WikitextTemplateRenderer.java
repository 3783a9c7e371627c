package com.e2eq.schemas.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits a unit as a wikitext template. Each value is guarded by {@code #if} so an absent
 * parameter renders nothing, and multi-value properties are stored with an explicit
 * {@code +sep} separator.
 */
public class WikitextTemplateRenderer implements UnitTemplateRenderer {

    @Override
    public String render(GenerationUnit unit) {
        List<String> lines = new ArrayList<>();
        lines.add("<noinclude>");
        lines.add("<!-- Generated for [[Category:" + unit.category() + "]], unit " + unit.identityKey() + " -->");
        lines.add("</noinclude><includeonly>");

        if (!unit.properties().isEmpty()) {
            lines.add("<div class=\"ss-section\">");
            for (FieldSpec f : unit.properties()) {
                lines.add(guarded(f.parameter(), row(f) + storage(f)));
            }
            lines.add("</div>");
        }

        for (SubobjectSpec s : unit.subobjects()) {
            lines.add(guarded(s.parameter(), "\n== " + s.label() + " ==\n{{{" + s.parameter() + "}}}\n"));
        }

        lines.add("[[Category:" + unit.category() + "]]");
        lines.add("</includeonly>");
        return String.join("\n", lines);
    }

    static String guarded(String parameter, String body) {
        return "{{#if:{{{" + parameter + "|}}}|" + body + "}}";
    }

    static String storage(FieldSpec f) {
        String value = "{{{" + f.parameter() + "|}}}";
        if (f.multiValue()) {
            return "{{#set:" + f.property() + "=" + value + "|+sep=" + PropertyInputMapper.LIST_DELIMITER + "}}";
        }
        return "{{#set:" + f.property() + "=" + value + "}}";
    }

    private static String row(FieldSpec f) {
        return "<div class=\"ss-row\"><span class=\"ss-label\">'''" + f.label() + ":'''</span> "
                + "<span class=\"ss-value\">{{{" + f.parameter() + "}}}</span></div>";
    }
}
