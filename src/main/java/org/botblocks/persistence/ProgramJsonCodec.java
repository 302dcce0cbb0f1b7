package org.botblocks.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.botblocks.model.Block;
import org.botblocks.model.BlockCatalog;
import org.botblocks.model.BlockConstructionException;
import org.botblocks.model.Program;
import org.botblocks.model.Rule;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the logical program as JSON. Visual layout is not part of the format.
 * <pre>
 * { "rules": [ { "event":   {"type": "button-pressed", "params": [0]},
 *                "states":  [ {"type": "state-equals", "params": [0, 1]} ],
 *                "actions": [ {"type": "set-motor-speed", "params": [0, 0]} ] } ] }
 * </pre>
 * Every block read goes through {@link BlockCatalog#create(String, List)}, so a program read
 * from disk holds only range-checked blocks.
 */
public class ProgramJsonCodec {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private final BlockCatalog catalog;

    public ProgramJsonCodec(BlockCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @param file The JSON file.
     * @return The program.
     * @throws ProgramFormatException if the content is not a valid program.
     * @throws IOException            if the file cannot be read.
     */
    public Program read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public Program parse(String json) throws ProgramFormatException {
        try {
            return read(new StringReader(json));
        } catch (ProgramFormatException e) {
            throw e;
        } catch (IOException e) {
            throw new ProgramFormatException("Failed to read program: " + e.getMessage(), e);
        }
    }

    /**
     * @param reader Source of the JSON text.
     * @return The program.
     * @throws ProgramFormatException if the content is not a valid program.
     * @throws IOException            if reading fails.
     */
    public Program read(Reader reader) throws IOException {
        ProgramDocument document;
        try {
            document = GSON.fromJson(reader, ProgramDocument.class);
        } catch (JsonParseException e) {
            throw new ProgramFormatException("Invalid program JSON: " + e.getMessage(), e);
        }
        if (document == null || document.rules == null) {
            return Program.empty();
        }
        List<Rule> rules = new ArrayList<>(document.rules.size());
        for (int i = 0; i < document.rules.size(); i++) {
            rules.add(toRule(i, document.rules.get(i)));
        }
        return new Program(rules);
    }

    private Rule toRule(int index, RuleDocument doc) throws ProgramFormatException {
        if (doc == null) {
            throw new ProgramFormatException("Rule " + index + ": null entry");
        }
        try {
            Block event = doc.event == null ? null : toBlock(doc.event);
            return new Rule(event, toBlocks(doc.states), toBlocks(doc.actions));
        } catch (BlockConstructionException e) {
            throw new ProgramFormatException("Rule " + index + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ProgramFormatException("Rule " + index + ": " + e.getMessage(), e);
        }
    }

    private List<Block> toBlocks(List<BlockDocument> docs) throws BlockConstructionException {
        List<Block> blocks = new ArrayList<>();
        if (docs != null) {
            for (BlockDocument doc : docs) {
                blocks.add(toBlock(doc));
            }
        }
        return blocks;
    }

    private Block toBlock(BlockDocument doc) throws BlockConstructionException {
        if (doc == null || doc.type == null) {
            throw new IllegalArgumentException("Block without type");
        }
        return catalog.create(doc.type, doc.params == null ? List.of() : doc.params);
    }

    /**
     * @param program The program to serialize.
     * @return Pretty-printed JSON.
     */
    public String toJson(Program program) {
        ProgramDocument document = new ProgramDocument();
        document.rules = new ArrayList<>();
        for (Rule rule : program.rules()) {
            RuleDocument doc = new RuleDocument();
            doc.event = rule.event() == null ? null : toDocument(rule.event());
            doc.states = rule.states().stream().map(ProgramJsonCodec::toDocument).toList();
            doc.actions = rule.actions().stream().map(ProgramJsonCodec::toDocument).toList();
            document.rules.add(doc);
        }
        return GSON.toJson(document);
    }

    public void write(Program program, Path file) throws IOException {
        Files.writeString(file, toJson(program), StandardCharsets.UTF_8);
    }

    private static BlockDocument toDocument(Block block) {
        BlockDocument doc = new BlockDocument();
        doc.type = block.identity();
        doc.params = block.parameters();
        return doc;
    }

    // Gson binding classes
    private static final class ProgramDocument {
        List<RuleDocument> rules;
    }

    private static final class RuleDocument {
        BlockDocument event;
        List<BlockDocument> states;
        List<BlockDocument> actions;
    }

    private static final class BlockDocument {
        String type;
        List<Integer> params;
    }
}
