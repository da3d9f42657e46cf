/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.filters;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;

/**
 * Tests for {@link FeatureGuardFilter} using {@link GuardedTestResource}.
 */
@QuarkusTest
class FeatureGuardFilterTest {

    @Test
    void testAllowedGroupReachesResource() {
        given().header(FeatureGuardFilter.GROUP_HEADER, "sales").header(FeatureGuardFilter.USER_ID_HEADER, "u1")
                .when().get("/test/guarded/voice").then().statusCode(200).body(equalTo("voice"));
    }

    @Test
    void testOtherGroupDenied() {
        given().header(FeatureGuardFilter.GROUP_HEADER, "basic").when().get("/test/guarded/voice").then()
                .statusCode(403).body("error", equalTo("Feature not available"))
                .body("message", equalTo("The voice_agent feature is not enabled for your account"))
                .body("feature", equalTo("voice_agent")).body("upgrade_required", equalTo(true));
    }

    @Test
    void testDisabledFlagDeniedForEveryone() {
        given().header(FeatureGuardFilter.GROUP_HEADER, "sales").when().get("/test/guarded/legacy").then()
                .statusCode(403).body("feature", equalTo("legacy_dashboard"));
    }

    @Test
    void testClassLevelAnnotationApplies() {
        given().when().get("/test/guarded/leads").then().statusCode(200).body(equalTo("leads"));
    }

    @Test
    void testRequireDenialMappedToForbidden() {
        given().header(FeatureGuardFilter.GROUP_HEADER, "sales").when().get("/test/guarded/programmatic").then()
                .statusCode(200).body(equalTo("programmatic"));

        given().header(FeatureGuardFilter.GROUP_HEADER, "basic").when().get("/test/guarded/programmatic").then()
                .statusCode(403).body("feature", equalTo("voice_agent")).body("upgrade_required", equalTo(true));
    }
}
