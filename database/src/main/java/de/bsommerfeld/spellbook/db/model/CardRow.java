package de.bsommerfeld.spellbook.db.model;

/**
 * One row of the {@code cards} table, in column order of
 * {@code insert-card.sql}. Prices are integer cents; list and map columns
 * hold JSON text.
 */
public record CardRow(
        String id,
        String oracleId,
        String name,
        String flavorName,
        String layout,
        String manaCost,
        Double cmc,
        String colors,
        String colorIdentity,
        String typeLine,
        String oracleText,
        String flavorText,
        String power,
        String toughness,
        String loyalty,
        String defense,
        String keywords,
        String setCode,
        String setName,
        String rarity,
        String collectorNumber,
        String artist,
        String releaseDate,
        boolean token,
        boolean promo,
        boolean digitalOnly,
        Integer edhrecRank,
        ImageUris images,
        Long priceUsd,
        Long priceUsdFoil,
        Long priceEur,
        Long priceEurFoil,
        PurchaseUris purchase,
        RelatedUris related,
        String illustrationId,
        boolean highresImage,
        String borderColor,
        String frame,
        boolean fullArt,
        int artPriority,
        String finishes,
        String legalities) {
}
