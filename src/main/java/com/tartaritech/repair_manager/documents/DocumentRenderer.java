package com.tartaritech.repair_manager.documents;

public interface DocumentRenderer {

    byte[] render(DocumentContent content);
}
