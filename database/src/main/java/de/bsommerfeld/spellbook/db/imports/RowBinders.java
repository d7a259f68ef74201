package de.bsommerfeld.spellbook.db.imports;

import de.bsommerfeld.spellbook.db.model.CardRow;
import de.bsommerfeld.spellbook.db.model.Ruling;
import de.bsommerfeld.spellbook.db.model.SetRow;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Parameter binding for the insert statements in {@code sql/insert-*.sql}.
 * Parameter order follows the column lists in those files.
 */
public final class RowBinders {

    private RowBinders() {
    }

    public static final JdbcBatchSink.RowBinder<CardRow> CARD = RowBinders::bindCard;
    public static final JdbcBatchSink.RowBinder<SetRow> SET = RowBinders::bindSet;
    public static final JdbcBatchSink.RowBinder<Ruling> RULING = RowBinders::bindRuling;

    /** Binds all 50 card parameters. */
    private static void bindCard(PreparedStatement ps, CardRow c) throws SQLException {
        int i = 1;
        ps.setString(i++, c.id());
        ps.setString(i++, c.oracleId());
        ps.setString(i++, c.name());
        ps.setString(i++, c.flavorName());
        ps.setString(i++, c.layout());
        ps.setString(i++, c.manaCost());
        setDouble(ps, i++, c.cmc());
        ps.setString(i++, c.colors());
        ps.setString(i++, c.colorIdentity());
        ps.setString(i++, c.typeLine());
        ps.setString(i++, c.oracleText());
        ps.setString(i++, c.flavorText());
        ps.setString(i++, c.power());
        ps.setString(i++, c.toughness());
        ps.setString(i++, c.loyalty());
        ps.setString(i++, c.defense());
        ps.setString(i++, c.keywords());
        ps.setString(i++, c.setCode());
        ps.setString(i++, c.setName());
        ps.setString(i++, c.rarity());
        ps.setString(i++, c.collectorNumber());
        ps.setString(i++, c.artist());
        ps.setString(i++, c.releaseDate());
        ps.setInt(i++, flag(c.token()));
        ps.setInt(i++, flag(c.promo()));
        ps.setInt(i++, flag(c.digitalOnly()));
        setInt(ps, i++, c.edhrecRank());
        ps.setString(i++, c.images().small());
        ps.setString(i++, c.images().normal());
        ps.setString(i++, c.images().large());
        ps.setString(i++, c.images().png());
        ps.setString(i++, c.images().artCrop());
        ps.setString(i++, c.images().borderCrop());
        setLong(ps, i++, c.priceUsd());
        setLong(ps, i++, c.priceUsdFoil());
        setLong(ps, i++, c.priceEur());
        setLong(ps, i++, c.priceEurFoil());
        ps.setString(i++, c.purchase().tcgplayer());
        ps.setString(i++, c.purchase().cardmarket());
        ps.setString(i++, c.purchase().cardhoarder());
        ps.setString(i++, c.related().edhrec());
        ps.setString(i++, c.related().gatherer());
        ps.setString(i++, c.illustrationId());
        ps.setInt(i++, flag(c.highresImage()));
        ps.setString(i++, c.borderColor());
        ps.setString(i++, c.frame());
        ps.setInt(i++, flag(c.fullArt()));
        ps.setInt(i++, c.artPriority());
        ps.setString(i++, c.finishes());
        ps.setString(i, c.legalities());
    }

    private static void bindSet(PreparedStatement ps, SetRow s) throws SQLException {
        ps.setString(1, s.code());
        ps.setString(2, s.name());
        ps.setString(3, s.setType());
        ps.setString(4, s.releaseDate());
        setInt(ps, 5, s.cardCount());
        ps.setString(6, s.iconSvgUri());
        ps.setString(7, s.block());
        setInt(ps, 8, s.baseSetSize());
        setInt(ps, 9, s.totalSetSize());
        ps.setInt(10, flag(s.onlineOnly()));
        ps.setInt(11, flag(s.foilOnly()));
        ps.setString(12, s.keyruneCode());
    }

    private static void bindRuling(PreparedStatement ps, Ruling r) throws SQLException {
        ps.setString(1, r.oracleId());
        ps.setString(2, r.publishedAt());
        ps.setString(3, r.comment());
        ps.setString(4, r.source());
    }

    private static int flag(boolean value) {
        return value ? 1 : 0;
    }

    private static void setInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) ps.setNull(index, Types.INTEGER);
        else ps.setInt(index, value);
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) ps.setNull(index, Types.INTEGER);
        else ps.setLong(index, value);
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) ps.setNull(index, Types.REAL);
        else ps.setDouble(index, value);
    }
}
