package com.chuckbox.reconcile.application.reconcile;

import com.chuckbox.reconcile.interfaces.batch.dto.CanonicalOutputDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.DiscrepancyOutputDocument;

public record ReconcileBatchResult(
        CanonicalOutputDocument canonical,
        DiscrepancyOutputDocument discrepancies
) {}
