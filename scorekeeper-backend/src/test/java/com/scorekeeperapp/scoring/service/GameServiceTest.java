package com.scorekeeperapp.scoring.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.scorekeeperapp.common.exception.ConflictException;
import com.scorekeeperapp.common.exception.NotFoundException;
import com.scorekeeperapp.scoring.domain.game.CompletionReason;
import com.scorekeeperapp.scoring.domain.game.GameProgression;
import com.scorekeeperapp.scoring.domain.game.GameRules;
import com.scorekeeperapp.scoring.domain.game.GameStatus;
import com.scorekeeperapp.scoring.domain.game.HalfInning;
import com.scorekeeperapp.scoring.domain.game.HomeAway;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.game.request.CreateGameRequest;
import com.scorekeeperapp.scoring.dto.game.request.GameActionRequest;
import com.scorekeeperapp.scoring.dto.game.request.RecordOpponentHalfInningRequest;
import com.scorekeeperapp.scoring.dto.game.response.GameResponse;
import com.scorekeeperapp.scoring.repository.memory.InMemoryGameRepository;
import com.scorekeeperapp.scoring.support.TestGames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GameService")
class GameServiceTest {

    private InMemoryGameRepository games;
    private GameService service;
    private Logger logger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(GameService.class);
        previousLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);

        games = new InMemoryGameRepository();
        service = new GameService(games, new GameProgression(TestGames.fixedClock()), GameRules.defaults(),
                new GameLocks(), TestGames.fixedClock());
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setLevel(previousLevel);
    }

    private String createGame(HomeAway ourSide) {
        return service.create(new CreateGameRequest(" Friday league ", "Tigers", ourSide)).getData().id();
    }

    @Test
    @DisplayName("a new game is in setup with no lineup")
    void create() {
        String id = createGame(HomeAway.HOME);

        GameResponse game = service.detail(new GameActionRequest(id)).getData();

        assertThat(game.name()).isEqualTo("Friday league");
        assertThat(game.status()).isEqualTo(GameStatus.SETUP);
        assertThat(game.lineupSet()).isFalse();
        assertThat(game.inning()).isNull();
    }

    @Test
    @DisplayName("starting without a lineup is a conflict")
    void startWithoutLineup() {
        String id = createGame(HomeAway.HOME);

        assertThatThrownBy(() -> service.start(new GameActionRequest(id)))
                .isInstanceOf(ConflictException.class)
                .extracting("errorCode").isEqualTo("LINEUP_REQUIRED");
    }

    @Test
    @DisplayName("the opponent's half-inning moves the game along")
    void opponentHalfInning() {
        String id = createGame(HomeAway.HOME);
        games.findById(id).orElseThrow().attachLineup(TestGames.lineup());
        service.start(new GameActionRequest(id));

        ApiResponse<GameResponse> response = service.recordOpponentHalfInning(new RecordOpponentHalfInningRequest(id, 2));

        assertThat(response.getData().awayRuns()).isEqualTo(2);
        assertThat(response.getData().half()).isEqualTo(HalfInning.BOTTOM);
        assertThat(response.getData().battingSide()).isEqualTo(HomeAway.HOME);
    }

    @Test
    @DisplayName("completing a game early marks it called")
    void complete() {
        String id = createGame(HomeAway.AWAY);
        games.findById(id).orElseThrow().attachLineup(TestGames.lineup());
        service.start(new GameActionRequest(id));

        GameResponse game = service.complete(new GameActionRequest(id)).getData();

        assertThat(game.status()).isEqualTo(GameStatus.COMPLETED);
        assertThat(game.completionReason()).isEqualTo(CompletionReason.CALLED);
    }

    @Test
    @DisplayName("unknown games are not found")
    void unknownGame() {
        assertThatThrownBy(() -> service.suspend(new GameActionRequest("missing")))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Game not found");
    }

    @Test
    @DisplayName("a rejected transition is logged with the game id first")
    void rejectionLog() {
        String id = createGame(HomeAway.HOME);

        assertThatThrownBy(() -> service.start(new GameActionRequest(id)))
                .isInstanceOf(ConflictException.class);

        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.DEBUG)
                .singleElement()
                .satisfies(e -> assertThat(e.getFormattedMessage())
                        .startsWith("Game " + id + " rejected for start: LINEUP_REQUIRED"));
    }
}
