package com.questrail.loadout.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.loadout.api.NodeKind;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.TreeNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * JsonNodeCatalogReader
 * -----------------------------------------------------------------------------
 * Reads a {@link NodeCatalog} from a JSON array of node objects:
 *
 * <pre>
 * [
 *   { "id": 90912, "name": "Vengeful Bonds", "maxRanks": 1, "type": "single",
 *     "section": "class", "reqPoints": 8 },
 *   { "id": 99823, "type": "subtree", "section": "hero",
 *     "entries": [ { "id": 123, "name": "Aldrachi Reaver" }, ... ] },
 *   { "id": 94915, "name": "Art of the Glaive", "section": "hero",
 *     "subTree": "Aldrachi Reaver" },
 *   ...
 * ]
 * </pre>
 *
 * <p>Recognised fields: {@code id} (required), {@code name}, {@code maxRanks}
 * (default 1), {@code type} ({@code "choice"}, {@code "subtree"}; anything
 * else is a normal node), {@code entries}, {@code freeNode},
 * {@code grantedForSpecs}, {@code reqPoints}, {@code section} (default
 * {@code "class"}) and {@code subTree}. Unknown fields are ignored.</p>
 *
 * <p>The catalog is sorted by id regardless of document order.</p>
 */
public final class JsonNodeCatalogReader
{
    private final ObjectMapper mapper;

    public JsonNodeCatalogReader() {
        this(new ObjectMapper());
    }

    public JsonNodeCatalogReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public NodeCatalog read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public NodeCatalog read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        return toCatalog(mapper.readTree(in));
    }

    public NodeCatalog parse(String json) throws IOException {
        Objects.requireNonNull(json, "json");
        return toCatalog(mapper.readTree(json));
    }

    private NodeCatalog toCatalog(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new CatalogFormatException("Catalog document must be a JSON array of nodes");
        }
        List<TreeNode> nodes = new ArrayList<>(root.size());
        int position = 0;
        for (JsonNode json : root) {
            nodes.add(toNode(json, position++));
        }
        try {
            return NodeCatalog.of(nodes);
        } catch (IllegalArgumentException e) {
            throw new CatalogFormatException(e.getMessage(), e);
        }
    }

    private TreeNode toNode(JsonNode json, int position) {
        if (!json.isObject() || !json.hasNonNull("id") || !json.get("id").canConvertToInt()) {
            throw new CatalogFormatException("Catalog entry " + position + " has no integer \"id\"");
        }
        int id = json.get("id").asInt();

        NodeKind kind = kindOf(json.path("type").asText(""));
        TreeNode.Builder b = TreeNode.builder(id, kind);
        b.name(json.path("name").asText(""))
                .maxRank(json.path("maxRanks").asInt(1))
                .granted(json.path("freeNode").asBoolean(false))
                .reqPoints(json.path("reqPoints").asInt(0));

        for (JsonNode tree : json.path("grantedForSpecs")) {
            b.grantedFor(tree.asInt());
        }
        // normal nodes may list their single spell as an entry; only choices keep them
        if (kind.carriesChoice()) {
            for (JsonNode entry : json.path("entries")) {
                b.entry(entry.path("id").asInt(0), entry.path("name").asText(""));
            }
        }

        try {
            b.section(Section.fromLabel(json.path("section").asText("class")));
            if (json.hasNonNull("subTree")) {
                b.subTree(json.get("subTree").asText());
            }
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new CatalogFormatException("Catalog node " + id + ": " + e.getMessage(), e);
        }
    }

    private static NodeKind kindOf(String type) {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "choice" -> NodeKind.CHOICE;
            case "subtree" -> NodeKind.SUBTREE_SELECTOR;
            default -> NodeKind.NORMAL;
        };
    }
}
