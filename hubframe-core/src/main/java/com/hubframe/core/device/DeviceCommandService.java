package com.hubframe.core.device;

import com.hubframe.api.device.Device;
import com.hubframe.api.exception.DeviceNotFoundException;
import com.hubframe.api.exception.NoDeviceOwnerException;
import com.hubframe.api.model.DeviceAction;
import com.hubframe.core.supervisor.RuntimeSupervisor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 设备命令
 * <p>
 * 把命令路由给设备的归属插件执行，成功后更新设备状态：
 * on / off / toggle 改开关，set 合并状态，execute 不改状态。
 */
@Slf4j
public class DeviceCommandService {

    public static final String DEVICE_ID_PARAM = "deviceId";
    public static final String ACTION_PARAM = "command";

    private final DeviceRegistry devices;
    private final DeviceOwnershipResolver ownership;
    private final RuntimeSupervisor supervisor;

    public DeviceCommandService(DeviceRegistry devices, DeviceOwnershipResolver ownership, RuntimeSupervisor supervisor) {
        this.devices = devices;
        this.ownership = ownership;
        this.supervisor = supervisor;
    }

    /**
     * @throws DeviceNotFoundException 设备不存在
     * @throws NoDeviceOwnerException  没有已加载的插件认领该设备
     */
    public CommandResult execute(String deviceId, String action, Map<String, Object> params) {
        DeviceAction deviceAction = DeviceAction.fromWire(action);
        Device device = devices.require(deviceId);
        String owner = ownership.resolveOwner(deviceId).orElseThrow(() -> new NoDeviceOwnerException(deviceId));

        Map<String, Object> args = new LinkedHashMap<>();
        if (params != null) {
            args.putAll(params);
        }
        args.put(DEVICE_ID_PARAM, deviceId);
        args.put(ACTION_PARAM, deviceAction.wireName());

        log.info("[{}] Device {} <- {}", owner, deviceId, deviceAction);
        Object result = supervisor.invoke(owner, "device." + deviceAction.wireName(), args);
        Device updated = applyState(device, deviceAction, params);
        return new CommandResult(deviceId, owner, deviceAction, result, updated);
    }

    private Device applyState(Device device, DeviceAction action, Map<String, Object> params) {
        return switch (action) {
            case ON -> devices.setPower(device.getId(), true);
            case OFF -> devices.setPower(device.getId(), false);
            case TOGGLE -> devices.setPower(device.getId(), !device.isOn());
            case SET -> params == null || params.isEmpty() ? device : devices.mergeState(device.getId(), params);
            case EXECUTE -> device;
        };
    }

    /**
     * 命令执行结果
     *
     * @param result 插件返回值
     * @param device 更新后的设备快照
     */
    public record CommandResult(
            @NonNull String deviceId,
            @NonNull String ownerPluginId,
            @NonNull DeviceAction action,
            Object result,
            @NonNull Device device
    ) {
        @Override
        public String toString() {
            return String.format("Command[%s %s via %s] -> %s", deviceId, action, ownerPluginId, result);
        }
    }
}
