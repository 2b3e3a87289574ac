/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Score;
import nu.xom.Builder;
import nu.xom.Document;
import nu.xom.ParsingException;
import org.xml.sax.SAXException;
import org.xml.sax.XMLReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

/**
 * Imports a partwise MusicXML document into a destination {@link Score}.
 * <pre>
 *     Score score = new Score();
 *     MusicXmlInput input = new MusicXmlInput(score);
 *     if (input.importFile(path))
 *         ...
 * </pre>
 * Both import methods return false if the document can't be parsed or is no partwise score. In that case the
 * destination score is left untouched. Every other anomaly of the input is reported in {@link #getWarnings()}.
 */
public class MusicXmlInput {
    private static final Logger logger = LoggerFactory.getLogger(MusicXmlInput.class);

    static final String LOAD_EXTERNAL_DTD = "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    private final Score score;
    private PageLayout pageLayout = PageLayout.NONE;
    private boolean loadExternalDtd = false;
    private ImportWarnings warnings = new ImportWarnings();

    public MusicXmlInput(Score score) {
        this.score = score;
    }

    public void setPageLayout(PageLayout pageLayout) {
        this.pageLayout = pageLayout;
    }

    /**
     * MusicXML files usually declare the partwise DTD on the web. It is not fetched unless set to true
     */
    public void setLoadExternalDtd(boolean loadExternalDtd) {
        this.loadExternalDtd = loadExternalDtd;
    }

    public boolean importFile(Path path) {
        try {
            Document document = createBuilder().build(path.toFile());
            return importDocument(document);
        } catch (ParsingException | IOException | SAXException | ParserConfigurationException e) {
            logger.error("Could not load file '{}': {}", path, e.getMessage());
            return false;
        }
    }

    public boolean importString(String content) {
        try {
            Document document = createBuilder().build(new StringReader(content));
            return importDocument(document);
        } catch (ParsingException | IOException | SAXException | ParserConfigurationException e) {
            logger.error("Could not parse document: {}", e.getMessage());
            return false;
        }
    }

    private boolean importDocument(Document document) {
        warnings = new ImportWarnings();
        try {
            new ScoreBuilder(score, warnings).convert(document.getRootElement());
        } catch (MusicXmlImportException e) {
            logger.error(e.getMessage());
            return false;
        }
        pageLayout.convertToPageBased(score);
        logger.debug("Import finished with {} warnings", warnings.size());
        return true;
    }

    private Builder createBuilder() throws SAXException, ParserConfigurationException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(true);
        XMLReader reader = factory.newSAXParser().getXMLReader();
        reader.setFeature(LOAD_EXTERNAL_DTD, loadExternalDtd);
        return new Builder(reader);
    }

    /**
     * @return warnings of the last import
     */
    public ImportWarnings getWarnings() {
        return warnings;
    }

    public Score getScore() {
        return score;
    }
}
