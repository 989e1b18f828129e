package com.codeops.notebook.dto.mapper;

import com.codeops.notebook.dto.request.CreateNoteRequest;
import com.codeops.notebook.dto.response.NoteResponse;
import com.codeops.notebook.entity.Note;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for Note entity to/from DTOs.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface NoteMapper {

    /**
     * Maps a create request to a new Note entity. The owner is set by the service.
     *
     * @param request the create request
     * @return the Note entity
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "ownerId", ignore = true)
    Note toEntity(CreateNoteRequest request);

    NoteResponse toResponse(Note entity);
}
