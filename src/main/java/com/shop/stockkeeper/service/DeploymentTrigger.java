package com.shop.stockkeeper.service;

import com.shop.stockkeeper.dto.OperationResult;

/**
 * Pulls and installs a new version of the application. Blocks until done.
 */
public interface DeploymentTrigger {

    OperationResult triggerUpdate();
}
