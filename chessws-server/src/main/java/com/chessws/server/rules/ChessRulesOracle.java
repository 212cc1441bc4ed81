package com.chessws.server.rules;

import java.util.regex.Pattern;

import io.github.wolfraam.chessgame.ChessGame;
import io.github.wolfraam.chessgame.board.Side;
import io.github.wolfraam.chessgame.move.Move;
import io.github.wolfraam.chessgame.notation.NotationType;
import io.github.wolfraam.chessgame.result.ChessGameResult;
import io.github.wolfraam.chessgame.result.ChessGameResultType;

import com.chessws.shared.util.Colour;
import com.chessws.shared.util.GameOverReason;
import com.chessws.shared.util.GameResult;

/**
 * {@link RulesOracle} backed by the wolfraam chessgame library. Accepts SAN ({@code Nf3})
 * and UCI ({@code g1f3}, {@code e7e8q}) input; broadcasts moves in SAN.
 */
public class ChessRulesOracle implements RulesOracle {

    private static final Pattern UCI = Pattern.compile("^[a-h][1-8][a-h][1-8][qrbnQRBN]?$");
    private static final Pattern ANNOTATION = Pattern.compile("[+#!?]+$");

    static final class ChessPosition implements Position {
        private final ChessGame game;

        ChessPosition(ChessGame game) {
            this.game = game;
        }

        @Override
        public String toString() {
            return game.getFen();
        }
    }

    @Override
    public Position newGame() {
        return new ChessPosition(new ChessGame());
    }

    /** Starts from an arbitrary FEN; used to set up specific positions. */
    Position fromFen(String fen) {
        return new ChessPosition(new ChessGame(fen));
    }

    @Override
    public AppliedMove applyMove(Position position, String moveText) throws IllegalMoveException {
        if (moveText == null || moveText.isBlank()) {
            throw new IllegalMoveException("empty move");
        }
        String text = moveText.trim();
        ChessGame next = unwrap(position).clone();
        Move move = parse(next, text);
        if (move == null || !next.isLegalMove(move)) {
            throw new IllegalMoveException("illegal move: " + text);
        }
        String san = next.getNotation(NotationType.SAN, move);
        next.playMove(move);
        return new AppliedMove(new ChessPosition(next), san);
    }

    private Move parse(ChessGame game, String text) throws IllegalMoveException {
        NotationType notation = UCI.matcher(text).matches() ? NotationType.UCI : NotationType.SAN;
        try {
            if (notation == NotationType.UCI) {
                return game.getMove(notation, text.toLowerCase());
            }
            // check and annotation marks are not part of the move
            return game.getMove(notation, ANNOTATION.matcher(text).replaceAll(""));
        } catch (RuntimeException e) {
            throw new IllegalMoveException("cannot parse move '" + text + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Outcome outcome(Position position) {
        ChessGameResult result = unwrap(position).getGameResult();
        if (result == null) {
            return Outcome.ONGOING;
        }
        if (result.chessGameResultType == ChessGameResultType.WHITE_WINS) {
            return Outcome.over(GameResult.WHITE_WIN, GameOverReason.CHECKMATE);
        }
        if (result.chessGameResultType == ChessGameResultType.BLACK_WINS) {
            return Outcome.over(GameResult.BLACK_WIN, GameOverReason.CHECKMATE);
        }
        if (result.drawType == null) {
            return Outcome.over(GameResult.DRAW, GameOverReason.STALEMATE);
        }
        switch (result.drawType) {
            case FIFTY_MOVE_RULE: return Outcome.over(GameResult.DRAW, GameOverReason.FIFTY_MOVE);
            case THREEFOLD_REPETITION: return Outcome.over(GameResult.DRAW, GameOverReason.REPETITION);
            case INSUFFICIENT_MATERIAL: return Outcome.over(GameResult.DRAW, GameOverReason.INSUFFICIENT_MATERIAL);
            default: return Outcome.over(GameResult.DRAW, GameOverReason.STALEMATE);
        }
    }

    @Override
    public String renderPosition(Position position) {
        return unwrap(position).getFen();
    }

    @Override
    public Colour sideToMove(Position position) {
        return unwrap(position).getSideToMove() == Side.WHITE ? Colour.WHITE : Colour.BLACK;
    }

    private static ChessGame unwrap(Position position) {
        if (!(position instanceof ChessPosition)) {
            throw new IllegalArgumentException("position was not created by this oracle: " + position);
        }
        return ((ChessPosition) position).game;
    }
}
