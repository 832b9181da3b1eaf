package com.playgrounds.apptool.editor;

import java.util.Optional;

/**
 * App Store categories accepted by {@code appCategory:}.
 */
public enum AppCategory implements SwiftName {
    BOOKS("books"),
    BUSINESS("business"),
    DEVELOPER_TOOLS("developerTools"),
    EDUCATION("education"),
    ENTERTAINMENT("entertainment"),
    FINANCE("finance"),
    FOOD_AND_DRINK("foodAndDrink"),
    GAMES("games"),
    ACTION_GAMES("actionGames"),
    ADVENTURE_GAMES("adventureGames"),
    BOARD_GAMES("boardGames"),
    CARD_GAMES("cardGames"),
    CASINO_GAMES("casinoGames"),
    CASUAL_GAMES("casualGames"),
    FAMILY_GAMES("familyGames"),
    KIDS_GAMES("kidsGames"),
    MUSIC_GAMES("musicGames"),
    PUZZLE_GAMES("puzzleGames"),
    RACING_GAMES("racingGames"),
    ROLE_PLAYING_GAMES("rolePlayingGames"),
    SIMULATION_GAMES("simulationGames"),
    SPORTS_GAMES("sportsGames"),
    STRATEGY_GAMES("strategyGames"),
    TRIVIA_GAMES("triviaGames"),
    WORD_GAMES("wordGames"),
    GRAPHICS_AND_DESIGN("graphicsAndDesign"),
    HEALTH_AND_FITNESS("healthAndFitness"),
    LIFESTYLE("lifestyle"),
    MAGAZINES_AND_NEWSPAPERS("magazinesAndNewspapers"),
    MEDICAL("medical"),
    MUSIC("music"),
    NAVIGATION("navigation"),
    NEWS("news"),
    PHOTOGRAPHY("photography"),
    PRODUCTIVITY("productivity"),
    REFERENCE("reference"),
    SHOPPING("shopping"),
    SOCIAL_NETWORKING("socialNetworking"),
    SPORTS("sports"),
    TRAVEL("travel"),
    UTILITIES("utilities"),
    VIDEO("video"),
    WEATHER("weather");

    private final String swiftName;

    AppCategory(String swiftName) {
        this.swiftName = swiftName;
    }

    @Override
    public String swiftName() {
        return swiftName;
    }

    public static AppCategory fromName(String name) {
        return SwiftName.fromName(AppCategory.class, name, "app category");
    }

    public static Optional<AppCategory> find(String name) {
        return SwiftName.find(AppCategory.class, name);
    }
}
