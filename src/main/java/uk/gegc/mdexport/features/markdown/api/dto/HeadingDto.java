package uk.gegc.mdexport.features.markdown.api.dto;

import uk.gegc.mdexport.features.markdown.domain.HeadingEntry;

public record HeadingDto(int level, String text, String id) {

    public static HeadingDto from(HeadingEntry entry) {
        return new HeadingDto(entry.level(), entry.text(), entry.id());
    }
}
