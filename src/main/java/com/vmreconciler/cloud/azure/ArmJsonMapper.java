package com.vmreconciler.cloud.azure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vmreconciler.cloud.DataDisk;
import com.vmreconciler.cloud.DiskCreateOption;
import com.vmreconciler.cloud.NetworkInterface;
import com.vmreconciler.cloud.OperationStatus;
import com.vmreconciler.cloud.OsDisk;
import com.vmreconciler.cloud.OsProfile;
import com.vmreconciler.cloud.ProvisioningState;
import com.vmreconciler.cloud.PublicIpAddress;
import com.vmreconciler.cloud.Subnet;
import com.vmreconciler.cloud.VirtualMachine;
import com.vmreconciler.core.model.HostCaching;

import java.util.ArrayList;

/**
 * Converts between ARM resource JSON and the cloud records.
 */
public class ArmJsonMapper {

    private final ObjectMapper objectMapper;

    public ArmJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // -- virtual machines --

    public VirtualMachine toVirtualMachine(JsonNode json) {
        var props = json.path("properties");
        var storage = props.path("storageProfile");

        OsDisk osDisk = null;
        var os = storage.path("osDisk");
        if (!os.isMissingNode()) {
            osDisk = new OsDisk(
                    text(os, "name"),
                    text(os.path("vhd"), "uri"),
                    caching(os),
                    createOption(os),
                    text(os.path("image"), "uri"));
        }

        var dataDisks = new ArrayList<DataDisk>();
        for (JsonNode d : storage.path("dataDisks")) {
            dataDisks.add(new DataDisk(
                    text(d, "name"),
                    text(d.path("vhd"), "uri"),
                    caching(d),
                    createOption(d),
                    d.path("lun").asInt(),
                    d.hasNonNull("diskSizeGB") ? d.get("diskSizeGB").asInt() : null));
        }

        var nics = new ArrayList<String>();
        for (JsonNode n : props.path("networkProfile").path("networkInterfaces")) {
            nics.add(text(n, "id"));
        }

        OsProfile osProfile = null;
        var profile = props.path("osProfile");
        if (!profile.isMissingNode()) {
            osProfile = new OsProfile(text(profile, "adminUsername"), null,
                    text(profile, "computerName"), null);
        }

        return new VirtualMachine(
                text(json, "name"),
                text(json, "location"),
                text(props.path("hardwareProfile"), "vmSize"),
                lastSegment(text(props.path("availabilitySet"), "id")),
                ProvisioningState.fromApiName(text(props, "provisioningState")),
                osProfile,
                osDisk,
                dataDisks,
                nics);
    }

    /**
     * Request body for a VM create-or-update. Read-only fields are left out.
     *
     * @param availabilitySetId full resource id, {@code null} for none
     */
    public ObjectNode toJson(VirtualMachine vm, String availabilitySetId) {
        var root = objectMapper.createObjectNode();
        root.put("name", vm.name());
        root.put("location", vm.location());
        var props = root.putObject("properties");
        props.putObject("hardwareProfile").put("vmSize", vm.size());
        if (availabilitySetId != null) {
            props.putObject("availabilitySet").put("id", availabilitySetId);
        }

        if (vm.osProfile() != null) {
            var profile = props.putObject("osProfile");
            profile.put("computerName", vm.osProfile().computerName());
            profile.put("adminUsername", vm.osProfile().adminUsername());
            if (vm.osProfile().adminPassword() != null) {
                profile.put("adminPassword", vm.osProfile().adminPassword());
            }
            if (vm.osProfile().customData() != null) {
                profile.put("customData", vm.osProfile().customData());
            }
        }

        var storage = props.putObject("storageProfile");
        if (vm.osDisk() != null) {
            var os = storage.putObject("osDisk");
            os.put("osType", "Linux");
            os.put("name", vm.osDisk().name());
            os.putObject("vhd").put("uri", vm.osDisk().uri());
            if (vm.osDisk().sourceImageUri() != null) {
                os.putObject("image").put("uri", vm.osDisk().sourceImageUri());
            }
            os.put("caching", vm.osDisk().caching().apiName());
            os.put("createOption", vm.osDisk().createOption().apiName());
        }
        var disks = storage.putArray("dataDisks");
        for (DataDisk disk : vm.dataDisks()) {
            var d = disks.addObject();
            d.put("lun", disk.lun());
            d.put("name", disk.name());
            d.putObject("vhd").put("uri", disk.uri());
            d.put("caching", disk.caching().apiName());
            d.put("createOption", disk.createOption().apiName());
            if (disk.sizeGb() != null) {
                d.put("diskSizeGB", disk.sizeGb());
            }
        }

        var nics = props.putObject("networkProfile").putArray("networkInterfaces");
        for (String id : vm.networkInterfaceIds()) {
            nics.addObject().put("id", id);
        }
        return root;
    }

    public OperationStatus toOperationStatus(JsonNode json) {
        var status = text(json, "status");
        if ("Succeeded".equalsIgnoreCase(status)) {
            return OperationStatus.succeeded();
        }
        if ("Failed".equalsIgnoreCase(status) || "Canceled".equalsIgnoreCase(status)) {
            var error = json.path("error");
            return OperationStatus.failed(error.isMissingNode() ? status : error.toString());
        }
        return OperationStatus.inProgress();
    }

    // -- network --

    public PublicIpAddress toPublicIp(JsonNode json) {
        return new PublicIpAddress(text(json, "id"), text(json, "name"),
                text(json.path("properties"), "ipAddress"));
    }

    public ObjectNode publicIpRequest(String location) {
        var root = objectMapper.createObjectNode();
        root.put("location", location);
        var props = root.putObject("properties");
        props.put("publicIPAllocationMethod", "Dynamic");
        props.put("idleTimeoutInMinutes", 4);
        return root;
    }

    public Subnet toSubnet(JsonNode json) {
        return new Subnet(text(json, "id"), text(json, "name"));
    }

    public NetworkInterface toNetworkInterface(JsonNode json) {
        String publicIpId = null;
        for (JsonNode config : json.path("properties").path("ipConfigurations")) {
            var ip = text(config.path("properties").path("publicIPAddress"), "id");
            if (ip != null) {
                publicIpId = ip;
                break;
            }
        }
        return new NetworkInterface(text(json, "id"), text(json, "name"), publicIpId);
    }

    public ObjectNode networkInterfaceRequest(String name, String location, Subnet subnet, String publicIpId) {
        var root = objectMapper.createObjectNode();
        root.put("name", name);
        root.put("location", location);
        var config = root.putObject("properties").putArray("ipConfigurations").addObject();
        config.put("name", "default");
        var props = config.putObject("properties");
        props.put("privateIPAllocationMethod", "Dynamic");
        props.putObject("subnet").put("id", subnet.id());
        if (publicIpId != null) {
            props.putObject("publicIPAddress").put("id", publicIpId);
        }
        return root;
    }

    private static HostCaching caching(JsonNode disk) {
        var value = text(disk, "caching");
        return value == null ? HostCaching.NONE : HostCaching.fromApiName(value);
    }

    private static DiskCreateOption createOption(JsonNode disk) {
        var value = text(disk, "createOption");
        return value == null ? DiskCreateOption.ATTACH : DiskCreateOption.fromApiName(value);
    }

    private static String text(JsonNode node, String field) {
        var value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String lastSegment(String id) {
        if (id == null) {
            return null;
        }
        return id.substring(id.lastIndexOf('/') + 1);
    }
}
