package com.codeops.notebook.service;

public enum FolderOrder {
    CREATED_DESC,
    NAME
}
