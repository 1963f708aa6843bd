package com.tinyeditor.services.upload;

import com.tinyeditor.core.context.EditorContext;

public interface UploadLimitService {

    /**
     * @return the largest file in bytes a user may upload in the context
     */
    long maxUploadSize(EditorContext context);
}
