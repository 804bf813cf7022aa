package com.mentionindex.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.mentionindex.config.EngineConfig;
import com.mentionindex.document.InMemoryDocumentStore;
import com.mentionindex.model.PersonRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class DefinitionLoaderTest {

    @Test
    void testLoadsOnlyMarkedDocuments() {
        InMemoryDocumentStore store = new InMemoryDocumentStore()
            .put("Acme.md", "---\ndef-type: consolidated\n---\n# John Smith\n---\n# Jane Doe\n")
            .put("people/Bob.md", "---\ndef-type: atomic\n---\n# Bob Johnson\n")
            .put("notes/daily.md", "# Not A Person\nJohn Smith called.\n");
        DefinitionLoader loader = new DefinitionLoader(store, new DefinitionDocumentParser(EngineConfig.defaults()));

        List<PersonRecord> marked = loader.loadMarkedDocuments();
        List<PersonRecord> all = loader.loadAllDocuments();

        assertEquals(List.of("John Smith", "Jane Doe", "Bob Johnson"),
            marked.stream().map(PersonRecord::fullName).toList());
        assertEquals(4, all.size());
    }

    @Test
    void testUnreadableDocumentIsSkipped() {
        InMemoryDocumentStore store = new InMemoryDocumentStore()
            .put("Acme.md", "# John Smith\n")
            .put("Broken.md", "# Jane Doe\n");
        store.failOn("Broken.md");
        DefinitionLoader loader = new DefinitionLoader(store, new DefinitionDocumentParser(EngineConfig.defaults()));

        List<PersonRecord> records = loader.loadAllDocuments();

        assertEquals(1, records.size());
        assertEquals("John Smith", records.get(0).fullName());
    }
}
