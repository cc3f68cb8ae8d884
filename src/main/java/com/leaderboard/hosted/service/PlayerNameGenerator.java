package com.leaderboard.hosted.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random display names for players that did not choose one.
 */
@Component
public class PlayerNameGenerator {

    private static final List<String> ADJECTIVES = List.of(
        "Swift", "Brave", "Clever", "Mighty", "Silent", "Lucky", "Fierce", "Nimble",
        "Cosmic", "Golden", "Crimson", "Frozen", "Electric", "Shadow", "Rapid", "Wild");

    private static final List<String> NOUNS = List.of(
        "Falcon", "Tiger", "Panda", "Wizard", "Knight", "Rocket", "Comet", "Dragon",
        "Otter", "Phoenix", "Ranger", "Pilot", "Badger", "Voyager", "Lynx", "Titan");

    public String generate() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return ADJECTIVES.get(random.nextInt(ADJECTIVES.size()))
            + NOUNS.get(random.nextInt(NOUNS.size()))
            + random.nextInt(100, 1000);
    }
}
