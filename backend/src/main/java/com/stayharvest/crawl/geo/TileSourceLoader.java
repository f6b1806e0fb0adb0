package com.stayharvest.crawl.geo;

import com.stayharvest.config.HarvesterProperties;
import com.stayharvest.crawl.model.Tile;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the tile list, one tile per line as {@code swLat,swLng|neLat,neLng}.
 * A tile's ordinal is its position among the non-blank lines, so skipping a malformed line does not
 * shift the ids of the tiles after it.
 */
@Component
public class TileSourceLoader {
    private static final Logger log = LoggerFactory.getLogger(TileSourceLoader.class);

    private final HarvesterProperties properties;

    public TileSourceLoader(HarvesterProperties properties) {
        this.properties = properties;
    }

    public List<Tile> load() {
        Path path = resolvePath(properties.getTileFile());
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Tile> tiles = parse(reader);
            log.info("Loaded {} tiles from {}", tiles.size(), path);
            return tiles;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tile file " + path, e);
        }
    }

    public List<Tile> parse(Reader reader) throws IOException {
        List<Tile> tiles = new ArrayList<>();
        int ordinal = 0;
        try (CSVParser parser = tileFormat().parse(reader)) {
            for (CSVRecord record : parser) {
                if (isBlank(record)) {
                    continue;
                }
                int current = ordinal++;
                try {
                    tiles.add(toTile(current, record));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping malformed tile line {}: {}", record.getRecordNumber(), e.getMessage());
                }
            }
        }
        return tiles;
    }

    private CSVFormat tileFormat() {
        return CSVFormat.DEFAULT.builder()
            .setDelimiter('|')
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .build();
    }

    private Tile toTile(int ordinal, CSVRecord record) {
        if (record.size() != 2) {
            throw new IllegalArgumentException("expected 'swLat,swLng|neLat,neLng' but got " + record.size() + " fields");
        }
        double[] sw = parsePair(record.get(0));
        double[] ne = parsePair(record.get(1));
        return new Tile(ordinal, sw[0], sw[1], ne[0], ne[1]);
    }

    private double[] parsePair(String raw) {
        String[] parts = raw.replace("\t", "").split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("expected 'lat,lng' but got '" + raw + "'");
        }
        try {
            return new double[] {Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim())};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a coordinate pair: '" + raw + "'", e);
        }
    }

    private boolean isBlank(CSVRecord record) {
        for (String value : record) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
