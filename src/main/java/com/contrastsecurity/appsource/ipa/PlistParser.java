package com.contrastsecurity.appsource.ipa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for XML property lists.
 *
 * Values map to {@code String}, {@code Boolean}, {@code Long}, {@code Double},
 * {@code List<Object>} and {@code Map<String, Object>}. {@code <data>} and
 * {@code <date>} are returned as their text. Binary property lists are not supported.
 */
public class PlistParser {
    private static final Logger logger = LoggerFactory.getLogger(PlistParser.class);
    private static final byte[] BINARY_MAGIC = "bplist".getBytes(StandardCharsets.US_ASCII);

    private PlistParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parse a property list whose root is a dictionary.
     */
    public static Map<String, Object> parseDictionary(byte[] content) throws PackageInspectionException {
        if (isBinary(content)) {
            throw new PackageInspectionException("Binary property lists are not supported");
        }
        Document document;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            document = builder.parse(new ByteArrayInputStream(content));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new PackageInspectionException("Cannot parse property list: " + e.getMessage(), e);
        }

        Element root = document.getDocumentElement();
        Element top = "plist".equals(root.getTagName()) ? firstChildElement(root) : root;
        if (top == null || !"dict".equals(top.getTagName())) {
            throw new PackageInspectionException("Property list root is not a dictionary");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) parseValue(top);
        return result;
    }

    static boolean isBinary(byte[] content) {
        if (content.length < BINARY_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < BINARY_MAGIC.length; i++) {
            if (content[i] != BINARY_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    private static Object parseValue(Element element) throws PackageInspectionException {
        String tag = element.getTagName();
        switch (tag) {
            case "dict":
                return parseDict(element);
            case "array":
                List<Object> list = new ArrayList<>();
                for (Element child : childElements(element)) {
                    list.add(parseValue(child));
                }
                return list;
            case "string":
            case "data":
            case "date":
                return element.getTextContent();
            case "integer":
                try {
                    return Long.parseLong(element.getTextContent().trim());
                } catch (NumberFormatException e) {
                    throw new PackageInspectionException("Invalid integer in property list: " + element.getTextContent(), e);
                }
            case "real":
                try {
                    return Double.parseDouble(element.getTextContent().trim());
                } catch (NumberFormatException e) {
                    throw new PackageInspectionException("Invalid real in property list: " + element.getTextContent(), e);
                }
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            default:
                logger.debug("Unknown property list element <{}>, reading as text", tag);
                return element.getTextContent();
        }
    }

    private static Map<String, Object> parseDict(Element dict) throws PackageInspectionException {
        Map<String, Object> map = new LinkedHashMap<>();
        List<Element> children = childElements(dict);
        for (int i = 0; i < children.size(); i++) {
            Element key = children.get(i);
            if (!"key".equals(key.getTagName())) {
                throw new PackageInspectionException("Expected <key> in dictionary, found <" + key.getTagName() + ">");
            }
            if (i + 1 >= children.size()) {
                throw new PackageInspectionException("Dictionary key without value: " + key.getTextContent());
            }
            map.put(key.getTextContent(), parseValue(children.get(++i)));
        }
        return map;
    }

    private static Element firstChildElement(Element parent) {
        List<Element> children = childElements(parent);
        return children.isEmpty() ? null : children.get(0);
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }
}
