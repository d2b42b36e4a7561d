package com.example.pawluxe_export.engine.Interfaces;

import com.example.pawluxe_export.dto.RenderJob;
import com.example.pawluxe_export.dto.RenderResult;
import com.example.pawluxe_export.engine.RenderCancellation;
import com.example.pawluxe_export.exception.RenderException;

public interface ClipRenderEngine {
    /**
     * Renders one attempt within {@link RenderJob#timeout()}. Scratch space used by the attempt is gone
     * when this method returns, whatever the outcome.
     */
    RenderResult render(RenderJob job, RenderCancellation cancellation) throws RenderException;
}
