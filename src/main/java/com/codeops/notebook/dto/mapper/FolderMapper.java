package com.codeops.notebook.dto.mapper;

import com.codeops.notebook.dto.request.CreateFolderRequest;
import com.codeops.notebook.dto.response.FolderResponse;
import com.codeops.notebook.entity.Folder;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for Folder entity to/from DTOs.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface FolderMapper {

    /**
     * Maps a create request to a new Folder entity. The owner is set by the service.
     *
     * @param request the create request
     * @return the Folder entity
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "ownerId", ignore = true)
    Folder toEntity(CreateFolderRequest request);

    FolderResponse toResponse(Folder entity);
}
