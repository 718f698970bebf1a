package com.nori.tc.deeplink.config;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.sequencer.CertificationTarget;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeepLinkPropertiesTests {

    @Test
    void defaults_are_valid_and_map_to_target() {
        DeepLinkProperties props = new DeepLinkProperties();
        props.validate();

        CertificationTarget target = props.toTarget();
        assertEquals("dev", target.appId());
        assertEquals("1234", target.content().contentId());
        assertTrue(target.content().requiresVideo());
        assertEquals(30_000, target.waitMs());
        assertNull(target.expectBeacon());
        assertEquals("192.168.1.114:8060", props.controlEndpoint().toString());
        assertEquals("192.168.1.114:8085", props.beaconEndpoint().toString());
    }

    @Test
    void signed_in_requires_script() {
        DeepLinkProperties props = new DeepLinkProperties();
        props.setSignedIn(true);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, props::validate);
        assertTrue(e.getMessage().startsWith("Signed-in mode requires a RASP script"));

        props.setScript("signin.rasp");
        props.validate();
    }

    @Test
    void host_must_be_dotted_ipv4() {
        DeepLinkProperties props = new DeepLinkProperties();
        props.getDevice().setHost("roku.local");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, props::validate);
        assertEquals("Invalid device IP address format: roku.local", e.getMessage());
    }

    @Test
    void launch_only_and_input_only_are_exclusive() {
        DeepLinkProperties props = new DeepLinkProperties();
        props.setLaunchOnly(true);
        props.setInputOnly(true);

        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void validate_script_mode_needs_only_script() {
        DeepLinkProperties props = new DeepLinkProperties();
        props.setMode(DeepLinkProperties.Mode.VALIDATE_SCRIPT);
        props.getDevice().setHost("not-an-ip");

        assertThrows(IllegalArgumentException.class, props::validate);
        props.setScript("signin.rasp");
        props.validate();
    }

    @Test
    void expect_beacon_becomes_category() {
        DeepLinkProperties props = new DeepLinkProperties();
        props.setExpectBeacon(" AdStartComplete ");
        props.getDiagnostics().setFailureLines(5);

        CertificationTarget target = props.toTarget();
        assertEquals(BeaconCategory.of("AdStartComplete"), target.expectBeacon());
        assertEquals(5, target.failureLines());
    }
}
