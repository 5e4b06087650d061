package com.finexec.application.port.out;

import com.finexec.domain.model.ActivityTree;
import io.vertx.core.Future;

/**
 * Output port for the activity catalog collaborator
 */
public interface ActivityCatalogProvider {

    /**
     * Fetch the activity tree of a program and facility type
     * @return Future failing with IllegalArgumentException when no catalog exists for the pair
     */
    Future<ActivityTree> fetchActivityTree(String programType, String facilityType);
}
