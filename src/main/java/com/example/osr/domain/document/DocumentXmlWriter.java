package com.example.osr.domain.document;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.Map;

/**
 * Serializes a document element tree with StAX, preserving attribute and child order.
 */
final class DocumentXmlWriter {

    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();

    private DocumentXmlWriter() {
    }

    static String write(DocumentElement root) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter writer = OUTPUT_FACTORY.createXMLStreamWriter(out);
            writeElement(writer, root);
            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to render order document", e);
        }
        return out.toString();
    }

    private static void writeElement(XMLStreamWriter writer, DocumentElement element) throws XMLStreamException {
        if (element.getChildren().isEmpty()) {
            writer.writeEmptyElement(element.getName());
            writeAttributes(writer, element);
            return;
        }
        writer.writeStartElement(element.getName());
        writeAttributes(writer, element);
        for (DocumentElement child : element.getChildren()) {
            writeElement(writer, child);
        }
        writer.writeEndElement();
    }

    private static void writeAttributes(XMLStreamWriter writer, DocumentElement element) throws XMLStreamException {
        for (Map.Entry<String, String> attribute : element.getAttributes().entrySet()) {
            writer.writeAttribute(attribute.getKey(), attribute.getValue());
        }
    }
}
