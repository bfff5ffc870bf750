package max.quorum.engine.game;

public enum PlayerState {
    IN_PROGRESS,
    // the winner holds all four objective squares
    QUORUM,
    // the player to move had no legal play and lost
    BLOCKED,
    // neither player could play
    DRAW;

    public boolean isGameOver() {
        return this != IN_PROGRESS;
    }
}
