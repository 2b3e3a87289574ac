/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import nu.xom.Element;
import nu.xom.Elements;
import nu.xom.Nodes;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helpers for reading MusicXML elements with XOM. Missing attributes and children read as empty strings
 * and malformed numbers read as 0, so callers never have to null-check plain values.
 */
public final class XmlNodes {
    static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";

    private XmlNodes() {}

    /**
     * @return the value of the attribute or an empty string if it or the element is absent
     */
    public static String attribute(@Nullable Element element, String name) {
        if (element == null)
            return "";
        return StringUtils.defaultString(element.getAttributeValue(name));
    }

    /**
     * @return the value of xml:lang or an empty string
     */
    public static String lang(Element element) {
        return StringUtils.defaultString(element.getAttributeValue("lang", XML_NAMESPACE));
    }

    public static boolean hasAttributeValue(@Nullable Element element, String name, String value) {
        return element != null && value.equals(element.getAttributeValue(name));
    }

    /**
     * @return the trimmed text of the first child with the given name or an empty string
     */
    public static String childValue(@Nullable Element element, String childName) {
        if (element == null)
            return "";
        Element child = element.getFirstChildElement(childName);
        if (child == null)
            return "";
        return StringUtils.trimToEmpty(child.getValue());
    }

    /**
     * @return the trimmed text of the first node matched by the path or an empty string
     */
    public static String pathValue(@Nullable Element element, String xpath) {
        Element match = first(element, xpath);
        if (match == null)
            return "";
        return StringUtils.trimToEmpty(match.getValue());
    }

    public static boolean hasChild(@Nullable Element element, String childName) {
        return element != null && element.getFirstChildElement(childName) != null;
    }

    /**
     * @return the first element matched by the XPath expression evaluated relative to the given element, or null. A
     * null context matches nothing
     */
    @Nullable
    public static Element first(@Nullable Element element, String xpath) {
        if (element == null)
            return null;
        Nodes nodes = element.query(xpath);
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) instanceof Element)
                return (Element) nodes.get(i);
        }
        return null;
    }

    public static List<Element> children(@Nullable Element element) {
        if (element == null)
            return new ArrayList<>();
        return toList(element.getChildElements());
    }

    public static List<Element> children(@Nullable Element element, String name) {
        if (element == null)
            return new ArrayList<>();
        return toList(element.getChildElements(name));
    }

    private static List<Element> toList(Elements elements) {
        List<Element> result = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            result.add(elements.get(i));
        }
        return result;
    }

    public static boolean isElement(Element element, String name) {
        return name.equals(element.getLocalName());
    }

    /**
     * Parse the leading integer of a string. Leading whitespace and a sign are accepted, parsing stops at the first
     * non-digit ("12.5" reads as 12). Returns 0 if there are no leading digits. Unlike
     * {@code NumberUtils.toInt}, which rejects the whole string, this keeps the integer part of decimal values
     * that some exporters write for durations and divisions.
     */
    public static int toInt(@Nullable String value) {
        String s = StringUtils.trimToEmpty(value);
        int i = 0;
        boolean negative = false;
        if (i < s.length() && (s.charAt(i) == '-' || s.charAt(i) == '+')) {
            negative = s.charAt(i) == '-';
            i++;
        }
        long result = 0;
        int start = i;
        while (i < s.length() && Character.isDigit(s.charAt(i)) && result <= Integer.MAX_VALUE) {
            result = result * 10 + (s.charAt(i) - '0');
            i++;
        }
        if (i == start)
            return 0;
        result = Math.min(result, Integer.MAX_VALUE);
        return (int) (negative ? -result : result);
    }

    /**
     * @return the integer value or null if the string is empty
     */
    @Nullable
    public static Integer toInteger(@Nullable String value) {
        if (StringUtils.isBlank(value))
            return null;
        return toInt(value);
    }
}
