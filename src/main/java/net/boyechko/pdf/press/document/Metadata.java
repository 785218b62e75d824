/*
 * PDF-Press - Pure Java PDF Generation
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.press.document;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Document information written to the trailer's {@code /Info} dictionary. Null fields are
 * omitted.
 */
public record Metadata(
        String title,
        String author,
        String subject,
        String keywords,
        String creator,
        String producer,
        OffsetDateTime creationDate,
        OffsetDateTime modDate) {

    public static final String DEFAULT_PRODUCER = "PDF-Press";

    /** Metadata with every field unset; see {@link #withDefaults}. */
    public static Metadata empty() {
        return new Metadata(null, null, null, null, null, null, null, null);
    }

    /** Fills in a missing producer and missing timestamps. */
    public Metadata withDefaults(String defaultProducer) {
        OffsetDateTime now = OffsetDateTime.now().truncatedTo(ChronoUnit.SECONDS);
        return new Metadata(
                title,
                author,
                subject,
                keywords,
                creator,
                producer == null || producer.isBlank() ? defaultProducer : producer,
                creationDate != null ? creationDate : now,
                modDate != null ? modDate : now);
    }

    public Metadata withTitle(String value) {
        return new Metadata(
                value, author, subject, keywords, creator, producer, creationDate, modDate);
    }

    public Metadata withAuthor(String value) {
        return new Metadata(
                title, value, subject, keywords, creator, producer, creationDate, modDate);
    }

    public Metadata withSubject(String value) {
        return new Metadata(
                title, author, value, keywords, creator, producer, creationDate, modDate);
    }

    public Metadata withKeywords(String value) {
        return new Metadata(
                title, author, subject, value, creator, producer, creationDate, modDate);
    }

    public Metadata withCreator(String value) {
        return new Metadata(
                title, author, subject, keywords, value, producer, creationDate, modDate);
    }
}
