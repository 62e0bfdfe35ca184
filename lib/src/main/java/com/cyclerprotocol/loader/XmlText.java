package com.cyclerprotocol.loader;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Character-data cleanup: comments dropped, CDATA unwrapped, entity references decoded, whitespace stripped. */
final class XmlText {
    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern CDATA = Pattern.compile("<!\\[CDATA\\[(.*?)]]>", Pattern.DOTALL);
    private static final Pattern REFERENCE = Pattern.compile("&(#x[0-9a-fA-F]+|#[0-9]+|[A-Za-z]+);");

    private XmlText() {}

    static String decode(String raw) {
        String withoutComments = COMMENT.matcher(raw).replaceAll("");
        StringBuilder out = new StringBuilder();
        Matcher cdata = CDATA.matcher(withoutComments);
        int last = 0;
        while (cdata.find()) {
            out.append(decodeReferences(withoutComments.substring(last, cdata.start())));
            out.append(cdata.group(1));
            last = cdata.end();
        }
        out.append(decodeReferences(withoutComments.substring(last)));
        return out.toString().strip();
    }

    private static String decodeReferences(String text) {
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolve(matcher.group(1))));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String resolve(String reference) {
        if (reference.startsWith("#x")) {
            return new String(Character.toChars(Integer.parseInt(reference.substring(2), 16)));
        }
        if (reference.startsWith("#")) {
            return new String(Character.toChars(Integer.parseInt(reference.substring(1))));
        }
        switch (reference) {
            case "lt":
                return "<";
            case "gt":
                return ">";
            case "amp":
                return "&";
            case "quot":
                return "\"";
            case "apos":
                return "'";
            default:
                throw new IllegalArgumentException("Unknown entity &" + reference + ";");
        }
    }
}
