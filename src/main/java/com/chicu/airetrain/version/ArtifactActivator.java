package com.chicu.airetrain.version;

import com.chicu.airetrain.ml.ModelArtifact;

/**
 * Хук serving path: сделать артефакт обслуживаемым.
 * Шаг (c) промоушена и шаг восстановления при откате.
 * Любое исключение = шаг не завершён.
 */
public interface ArtifactActivator {

    void activate(long versionId, ModelArtifact artifact);
}
