package org.spelunk.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Enemy;
import org.spelunk.runtime.model.LevelLayout;
import org.spelunk.runtime.model.Platform;
import org.spelunk.runtime.model.Point;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes a generated level as JSON for the game client. Cell coordinates are exported together with
 * pixel coordinates: entity positions at the cell centre, platforms at their top-left corner.
 */
public final class LevelJsonExporter {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final int tileSize;

    public LevelJsonExporter(int tileSize) {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("tileSize must be positive, got " + tileSize);
        }
        this.tileSize = tileSize;
    }

    public JsonNode toTree(LevelLayout level) {
        CaveGrid grid = level.grid();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("seed", level.seed());
        root.put("width", grid.getWidth());
        root.put("height", grid.getHeight());
        root.put("tileSize", tileSize);

        ArrayNode rows = root.putArray("grid");
        for (int y = 0; y < grid.getHeight(); y++) {
            ArrayNode row = rows.addArray();
            for (int x = 0; x < grid.getWidth(); x++) {
                row.add((int) grid.get(x, y));
            }
        }

        root.set("spawn", point(level.spawn()));
        root.set("goal", point(level.goal()));

        ArrayNode coins = root.putArray("coins");
        for (Point coin : level.coins()) {
            coins.add(point(coin));
        }

        ArrayNode platforms = root.putArray("platforms");
        for (Platform platform : level.platforms()) {
            ObjectNode node = platforms.addObject();
            node.put("x", platform.x());
            node.put("y", platform.y());
            node.put("width", platform.width());
            node.put("height", platform.height());
            node.put("type", platform.type().name());
            node.put("px", platform.x() * tileSize);
            node.put("py", platform.y() * tileSize);
        }

        ArrayNode enemies = root.putArray("enemies");
        for (Enemy enemy : level.enemies()) {
            ObjectNode node = point(enemy.position());
            node.put("type", enemy.type());
            node.put("placementType", enemy.placementType());
            ObjectNode attributes = node.putObject("attributes");
            for (Map.Entry<String, Object> entry : enemy.attributes().entrySet()) {
                attributes.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
            }
            enemies.add(node);
        }
        return root;
    }

    public String toJson(LevelLayout level) throws IOException {
        return objectMapper.writeValueAsString(toTree(level));
    }

    public void write(LevelLayout level, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), toTree(level));
    }

    private ObjectNode point(Point p) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("x", p.x());
        node.put("y", p.y());
        node.put("px", p.x() * tileSize + tileSize / 2);
        node.put("py", p.y() * tileSize + tileSize / 2);
        return node;
    }
}
