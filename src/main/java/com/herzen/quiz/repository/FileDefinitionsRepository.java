package com.herzen.quiz.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.quiz.config.QuizProperties;
import com.herzen.quiz.game.Game;
import com.herzen.quiz.game.GameDefinitionValidator;
import com.herzen.quiz.game.GameDefinitionValidator.DefinitionIssue;
import com.herzen.quiz.game.GameModels.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads {@code channels.json} and every {@code game-*.json} under the configured location once, at startup.
 * The location is a Spring resource location; a plain directory path is treated as {@code file:}.
 * Any read, parse or validation failure aborts context startup.
 */
@Repository
public class FileDefinitionsRepository implements DefinitionsRepository {
    private static final Logger log = LoggerFactory.getLogger(FileDefinitionsRepository.class);

    private final Map<Integer, Game> games;
    private final Map<String, Channel> channels;

    public FileDefinitionsRepository(QuizProperties properties,
                                     ResourcePatternResolver resolver,
                                     GameDefinitionValidator validator) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        String location = toLocation(properties.definitions().location());

        List<Channel> channelList = loadChannels(mapper, resolver, location);
        List<Game> gameList = loadGames(mapper, resolver, location);

        List<DefinitionIssue> issues = validator.validate(gameList, channelList);
        if (!issues.isEmpty()) {
            throw new DefinitionLoadException("Invalid definitions in " + location, issues);
        }

        this.channels = channelList.stream().collect(Collectors.toUnmodifiableMap(Channel::channelId, Function.identity()));
        this.games = gameList.stream().collect(Collectors.toUnmodifiableMap(Game::id, Function.identity()));
        log.info("Loaded {} channels and {} games from {}", channels.size(), games.size(), location);
    }

    @Override
    public Optional<Game> getGameById(int gameId) {
        return Optional.ofNullable(games.get(gameId));
    }

    @Override
    public Optional<Channel> getChannelById(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    public Collection<Game> games() {
        return games.values();
    }

    private List<Channel> loadChannels(ObjectMapper mapper, ResourcePatternResolver resolver, String location) {
        Resource resource = resolver.getResource(location + "/channels.json");
        try (InputStream in = resource.getInputStream()) {
            List<Channel> list = mapper.readValue(in, new TypeReference<List<Channel>>() {});
            return list == null ? List.of() : list;
        } catch (IOException e) {
            throw new DefinitionLoadException("Failed to load channels from " + resource.getDescription(), e);
        }
    }

    private List<Game> loadGames(ObjectMapper mapper, ResourcePatternResolver resolver, String location) {
        Resource[] resources;
        try {
            resources = resolver.getResources(location + "/game-*.json");
        } catch (IOException e) {
            throw new DefinitionLoadException("Failed to list games in " + location, e);
        }

        List<Game> result = new ArrayList<>();
        Arrays.stream(resources)
                .sorted(Comparator.comparing(r -> Objects.requireNonNullElse(r.getFilename(), "")))
                .forEach(resource -> {
                    try (InputStream in = resource.getInputStream()) {
                        result.add(mapper.readValue(in, Game.class));
                    } catch (IOException e) {
                        throw new DefinitionLoadException("Failed to load game from " + resource.getDescription(), e);
                    }
                });
        return result;
    }

    // A bare directory such as /srv/quiz/data or ./deploy/data is read from the filesystem.
    static String toLocation(String location) {
        String trimmed = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
        int colon = trimmed.indexOf(':');
        int slash = trimmed.indexOf('/');
        boolean hasPrefix = colon > 1 && (slash < 0 || colon < slash);
        return hasPrefix ? trimmed : "file:" + trimmed;
    }
}
